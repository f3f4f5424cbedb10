/**
 * Orchestration of recognition, slide following and sync.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.slidefollow.service.orchestration.DefaultSlideFollowOrchestrator} -
 *       Evaluates final transcripts on a single-threaded follow loop, applies manual and remote
 *       overrides, and restarts failed sessions with backoff when enabled</li>
 *   <li>{@link com.phillippitts.slidefollow.service.orchestration.DefaultSlideFollowOrchestratorBuilder} -
 *       Fluent construction with required/optional collaborators</li>
 * </ul>
 *
 * <p>Design Patterns:
 * <ul>
 *   <li><b>Event-Driven:</b> Live slide changes and recognition failures are published through
 *       Spring's ApplicationEventPublisher (see {@code service.orchestration.event})</li>
 *   <li><b>Single Writer:</b> Follow state is changed only under the orchestrator's state lock</li>
 * </ul>
 *
 * @see com.phillippitts.slidefollow.service.follow.SlideFollowEngine
 * @see com.phillippitts.slidefollow.service.recognition.RecognitionSession
 * @since 1.0
 */
package com.phillippitts.slidefollow.service.orchestration;

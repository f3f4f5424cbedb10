/**
 * Service layer containing the follow logic and its collaborators.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.follow} - Pure slide follow engine (tokenizer, scorer, rules)</li>
 *   <li>{@code service.recognition} - Streaming recognition session client</li>
 *   <li>{@code service.audio} - Microphone capture and PCM encoding</li>
 *   <li>{@code service.orchestration} - Connects recognition to the engine; owns the live slide</li>
 *   <li>{@code service.sync} - Live slide exchange with other instances</li>
 *   <li>{@code service.transport} - WebSocket abstraction shared by recognition and sync</li>
 *   <li>{@code service.health}, {@code service.metrics}, {@code service.events} - Observability</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services depend on domain models, not on the presentation layer</li>
 *   <li>Services throw domain exceptions (not HTTP exceptions)</li>
 *   <li>Services use constructor injection (not field injection)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.slidefollow.service;

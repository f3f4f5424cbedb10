/**
 * Immutable value types shared by the recognition client, the follow engine and the orchestrator.
 */
package com.phillippitts.slidefollow.domain;

/**
 * Global exception handling for HTTP responses.
 */
package com.phillippitts.slidefollow.presentation.exception;

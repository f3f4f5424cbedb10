/**
 * Live slide synchronization between instances over a WebSocket sync server.
 */
package com.phillippitts.slidefollow.service.sync;

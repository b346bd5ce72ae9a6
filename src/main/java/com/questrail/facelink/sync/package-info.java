/**
 * Coordination of remote audio playback with mouth animation.
 */
package com.questrail.facelink.sync;

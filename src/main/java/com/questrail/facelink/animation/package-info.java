/**
 * Frame-accurate playback of mouth envelopes over a fire-and-forget channel.
 */
package com.questrail.facelink.animation;

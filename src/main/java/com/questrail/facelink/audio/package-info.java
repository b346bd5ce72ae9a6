/**
 * Audio decoding and loudness envelope extraction for mouth animation.
 */
package com.questrail.facelink.audio;

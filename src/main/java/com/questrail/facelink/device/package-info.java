/**
 * Device-level facades: the face display's command set, its touch button, and
 * the servo board.
 */
package com.questrail.facelink.device;

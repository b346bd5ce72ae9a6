/**
 * Composition root wiring transport, session, display facade and mouth sync.
 */
package com.questrail.facelink.runtime;

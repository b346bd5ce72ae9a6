package com.questrail.facelink.protocol.model;

/**
 * LinkMessage
 * -----------------------------------------------------------------------------
 * Result of classifying one inbound protocol line.
 *
 * <p>Every line the device writes is decided exactly once, at parse time, into
 * one of three variants:</p>
 * <ul>
 *   <li>{@link DeviceEvent}: the object carries an {@code event} key (this wins
 *       over any other key)</li>
 *   <li>{@link DeviceResponse}: the object carries a {@code status} key</li>
 *   <li>{@link MalformedLine}: anything else (boot logs, debug prints, JSON
 *       that is not an object or carries neither key)</li>
 * </ul>
 *
 * <p>Call sites switch on the variant instead of sniffing keys.</p>
 */
public sealed interface LinkMessage permits DeviceEvent, DeviceResponse, MalformedLine
{
}

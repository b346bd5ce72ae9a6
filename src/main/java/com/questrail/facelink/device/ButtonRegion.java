package com.questrail.facelink.device;

import com.questrail.facelink.protocol.model.DeviceEvent;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Screen rectangle treated as the on-screen button, bounds inclusive.
 */
public record ButtonRegion(int left, int top, int right, int bottom)
{
    /** Bottom-centre button of the 480×480 panel. */
    public static final ButtonRegion DEFAULT = new ButtonRegion(150, 400, 330, 455);

    public ButtonRegion {
        if (left > right || top > bottom) {
            throw new IllegalArgumentException("empty region: " + left + "," + top + "," + right + "," + bottom);
        }
    }

    public boolean contains(int x, int y) {
        return x >= left && x <= right && y >= top && y <= bottom;
    }

    /**
     * Whether {@code event} counts as a press.
     *
     * <p>{@code button} and {@code button_down} always count. A {@code touch}
     * counts when {@code touchAnywhere} is set or its coordinates fall inside
     * this region. {@code button_up} and anything else never count.</p>
     */
    public boolean isPress(DeviceEvent event, boolean touchAnywhere) {
        Objects.requireNonNull(event, "event");

        if (event.is(DeviceEvent.BUTTON) || event.is(DeviceEvent.BUTTON_DOWN)) {
            return true;
        }
        if (!event.is(DeviceEvent.TOUCH)) {
            return false;
        }
        if (touchAnywhere) {
            return true;
        }

        OptionalInt x = event.intField("x");
        OptionalInt y = event.intField("y");
        return x.isPresent() && y.isPresent() && contains(x.getAsInt(), y.getAsInt());
    }
}

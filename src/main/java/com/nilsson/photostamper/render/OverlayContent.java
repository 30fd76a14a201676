package com.nilsson.photostamper.render;

import com.nilsson.photostamper.model.ResolvedAddress;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 The four strings printed on an image: time, date, weekday and place.
 */
public final class OverlayContent {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm", Locale.ROOT);
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy/MM/dd", Locale.ROOT);

    private final String timeText;
    private final String dateText;
    private final String weekdayText;
    private final String addressText;

    public OverlayContent(String timeText, String dateText, String weekdayText, String addressText) {
        this.timeText = timeText;
        this.dateText = dateText;
        this.weekdayText = weekdayText;
        this.addressText = addressText == null || addressText.isEmpty() ? ResolvedAddress.BLANK : addressText;
    }

    /**
     @param capturedAt    capture time shown on the image
     @param weekdayLocale language of the weekday name
     @param address       resolved place; its text is used even when unresolved (blank placeholder)
     */
    public static OverlayContent of(LocalDateTime capturedAt, Locale weekdayLocale, ResolvedAddress address) {
        return new OverlayContent(
                capturedAt.format(TIME),
                capturedAt.format(DATE),
                capturedAt.getDayOfWeek().getDisplayName(TextStyle.FULL, weekdayLocale),
                address.getText());
    }

    public String getTimeText() {
        return timeText;
    }

    public String getDateText() {
        return dateText;
    }

    public String getWeekdayText() {
        return weekdayText;
    }

    public String getAddressText() {
        return addressText;
    }

    @Override
    public String toString() {
        return timeText + " " + dateText + " " + weekdayText + " [" + addressText + "]";
    }
}

package com.nilsson.photostamper.render;

/**
 Resolution-proportional sizes for one image's overlay.
 * <p>Everything derives from {@code min(width, height)}:</p>
 <ul>
 <li>base (time) font: 5%</li>
 <li>date and weekday font: 40% of base</li>
 <li>address font: 60% of base</li>
 <li>margin: 2%</li>
 <li>line spacing: 30% of base</li>
 </ul>
 * <p>Values are truncated to whole pixels; font sizes never drop below 1.
 A layout is computed per image and never reused for another.</p>
 */
public final class OverlayLayout {

    static final double BASE_FONT_RATIO = 0.05;
    static final double DATE_FONT_RATIO = 0.4;
    static final double ADDRESS_FONT_RATIO = 0.6;
    static final double MARGIN_RATIO = 0.02;
    static final double LINE_SPACING_RATIO = 0.3;
    static final double BAR_WIDTH_RATIO = 0.2;
    static final double BAR_HEIGHT_RATIO = 1.3;

    private final int imageWidth;
    private final int imageHeight;
    private final int baseFontSize;
    private final int dateFontSize;
    private final int addressFontSize;
    private final int margin;
    private final int lineSpacing;

    private OverlayLayout(int imageWidth, int imageHeight) {
        int shortSide = Math.min(imageWidth, imageHeight);
        this.imageWidth = imageWidth;
        this.imageHeight = imageHeight;

        int base = (int) (shortSide * BASE_FONT_RATIO);
        this.baseFontSize = Math.max(1, base);
        this.dateFontSize = Math.max(1, (int) (base * DATE_FONT_RATIO));
        this.addressFontSize = Math.max(1, (int) (base * ADDRESS_FONT_RATIO));
        this.margin = (int) (shortSide * MARGIN_RATIO);
        this.lineSpacing = (int) (base * LINE_SPACING_RATIO);
    }

    public static OverlayLayout forImage(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        }
        return new OverlayLayout(width, height);
    }

    public int getImageWidth() {
        return imageWidth;
    }

    public int getImageHeight() {
        return imageHeight;
    }

    /** Time font size. */
    public int getBaseFontSize() {
        return baseFontSize;
    }

    /** Shared by the date and weekday lines. */
    public int getDateFontSize() {
        return dateFontSize;
    }

    public int getWeekdayFontSize() {
        return dateFontSize;
    }

    public int getAddressFontSize() {
        return addressFontSize;
    }

    public int getMargin() {
        return margin;
    }

    public int getLineSpacing() {
        return lineSpacing;
    }

    // --- Placement, given the measured time text ---

    /**
     Top of the time row. Leaves room below it for two line spacings, the address line and a double margin.
     */
    public int timeY(int timeTextHeight) {
        return imageHeight - timeTextHeight - margin * 2 - addressFontSize - lineSpacing * 2;
    }

    public int barWidth(int timeTextHeight) {
        return (int) (timeTextHeight * BAR_WIDTH_RATIO);
    }

    public int barHeight(int timeTextHeight) {
        return (int) Math.round(timeTextHeight * BAR_HEIGHT_RATIO);
    }

    public int weekdayOffset() {
        return dateFontSize + (int) (lineSpacing * 0.5);
    }

    public int addressY(int timeY, int timeTextHeight) {
        return timeY + timeTextHeight + lineSpacing * 2;
    }

    @Override
    public String toString() {
        return "OverlayLayout{" + imageWidth + "x" + imageHeight + ", base=" + baseFontSize + ", date=" + dateFontSize
                + ", address=" + addressFontSize + ", margin=" + margin + ", spacing=" + lineSpacing + "}";
    }
}

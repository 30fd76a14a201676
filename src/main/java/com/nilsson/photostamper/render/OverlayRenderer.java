package com.nilsson.photostamper.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.font.FontRenderContext;
import java.awt.font.TextLayout;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;

/**
 <h2>OverlayRenderer</h2>
 <p>
 Draws the timestamp overlay into the bottom-left corner of an image, in place.
 </p>

 <h3>Arrangement:</h3>
 <pre>
   HH:mm  |  yyyy/MM/dd
          |  weekday
   address
 </pre>
 <ul>
 <li>The time sits at the margin; its row is lifted far enough that the address line fits below.</li>
 <li>The yellow bar starts one margin right of the time; it is 20% of the time height wide
 and 1.3 times as tall.</li>
 <li>Date and weekday start one margin right of the bar; the weekday drops by the date font size
 plus half a line spacing.</li>
 <li>The address starts at the margin, two line spacings under the time row.</li>
 </ul>
 <p>
 All coordinates refer to the top-left corner of the text's ink box. Sizes come from an
 {@link OverlayLayout} computed for this image alone.
 </p>
 */
public class OverlayRenderer {

    private static final Logger logger = LoggerFactory.getLogger(OverlayRenderer.class);

    public static final Color TEXT_COLOR = new Color(255, 255, 255);
    public static final Color ACCENT_COLOR = new Color(255, 255, 0);

    /**
     Draws {@code content} onto {@code image} using sizes derived from the image itself.

     @param image    target, already upright and in RGB; modified in place
     @param content  the strings to draw
     @param fontFace the face to size; its own size is ignored
     @return the layout that was used, for diagnostics
     */
    public OverlayLayout render(BufferedImage image, OverlayContent content, Font fontFace) {
        OverlayLayout layout = OverlayLayout.forImage(image.getWidth(), image.getHeight());

        Font timeFont = fontFace.deriveFont((float) layout.getBaseFontSize());
        Font dateFont = fontFace.deriveFont((float) layout.getDateFontSize());
        Font weekdayFont = fontFace.deriveFont((float) layout.getWeekdayFontSize());
        Font addressFont = fontFace.deriveFont((float) layout.getAddressFontSize());

        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setRenderingHint(RenderingHints.KEY_FRACTIONALMETRICS, RenderingHints.VALUE_FRACTIONALMETRICS_ON);
            FontRenderContext frc = g.getFontRenderContext();

            TextLayout time = new TextLayout(content.getTimeText(), timeFont, frc);
            Rectangle2D timeBox = time.getBounds();
            int timeWidth = (int) Math.ceil(timeBox.getWidth());
            int timeHeight = (int) Math.ceil(timeBox.getHeight());

            int margin = layout.getMargin();
            int timeX = margin;
            int timeY = layout.timeY(timeHeight);

            int barX = timeX + timeWidth + margin;
            int barWidth = layout.barWidth(timeHeight);
            int barHeight = layout.barHeight(timeHeight);

            int dateX = barX + barWidth + margin;
            int weekdayY = timeY + layout.weekdayOffset();
            int addressY = layout.addressY(timeY, timeHeight);

            g.setColor(ACCENT_COLOR);
            g.fillRect(barX, timeY, Math.max(1, barWidth), Math.max(1, barHeight));

            g.setColor(TEXT_COLOR);
            drawAt(g, time, timeX, timeY);
            drawAt(g, new TextLayout(content.getDateText(), dateFont, frc), dateX, timeY);
            drawAt(g, new TextLayout(content.getWeekdayText(), weekdayFont, frc), dateX, weekdayY);
            drawAt(g, new TextLayout(content.getAddressText(), addressFont, frc), margin, addressY);

            logger.debug("Rendered '{}' with {}", content, layout);
        } finally {
            g.dispose();
        }
        return layout;
    }

    /**
     Draws so that the ink box's top-left lands on {@code (x, y)}.
     */
    private void drawAt(Graphics2D g, TextLayout text, int x, int y) {
        Rectangle2D ink = text.getBounds();
        text.draw(g, (float) (x - ink.getX()), (float) (y - ink.getY()));
    }
}

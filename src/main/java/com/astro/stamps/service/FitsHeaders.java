package com.astro.stamps.service;

import com.astro.stamps.model.StampDataException;
import com.astro.stamps.model.StampDataException.Kind;
import com.astro.stamps.model.StampHeader;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.util.BufferedDataInputStream;
import nom.tam.util.Cursor;

/**
 * Conversions between nom.tam headers and {@link StampHeader}.
 */
public final class FitsHeaders {

    static final int CARD_LENGTH = 80;

    private FitsHeaders() {
    }

    public static StampHeader toStampHeader(Header header) {
        Map<String, String> values = new LinkedHashMap<>();
        StringBuilder text = new StringBuilder();
        Cursor<String, HeaderCard> it = header.iterator();
        while (it.hasNext()) {
            HeaderCard card = it.next();
            text.append(card.toString());
            putValue(values, card);
        }
        return new StampHeader(values, text.toString());
    }

    /** Parses concatenated 80-character cards, as produced by {@link #toStampHeader}. */
    public static StampHeader parse(String headerText) throws StampDataException {
        Map<String, String> values = new LinkedHashMap<>();
        for (int start = 0; start < headerText.length(); start += CARD_LENGTH) {
            String image = headerText.substring(start, Math.min(start + CARD_LENGTH, headerText.length()));
            if (image.isBlank() || image.startsWith("END ") || image.equals("END")) continue;
            byte[] bytes = String.format("%-" + CARD_LENGTH + "s", image).getBytes(StandardCharsets.US_ASCII);
            try (BufferedDataInputStream in = new BufferedDataInputStream(new ByteArrayInputStream(bytes))) {
                putValue(values, new HeaderCard(in));
            } catch (Exception e) {
                throw new StampDataException(Kind.MALFORMED_VALUE, "unparseable header card '" + image.trim() + "'", e);
            }
        }
        return new StampHeader(values, headerText);
    }

    // COMMENT, HISTORY and blank cards carry no value
    private static void putValue(Map<String, String> values, HeaderCard card) {
        if (card.getKey() != null && card.getValue() != null) {
            values.put(card.getKey(), card.getValue());
        }
    }
}

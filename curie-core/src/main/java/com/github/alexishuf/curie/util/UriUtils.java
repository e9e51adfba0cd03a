package com.github.alexishuf.curie.util;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class UriUtils {
    /**
     * HEX[i] == Integer.toHexString(i).toUpperCase().charAt(0)
     */
    private static final char[] HEX = {
            '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'A', 'B', 'C', 'D', 'E', 'F'
    };

    /**
     * As per <a href="https://www.rfc-editor.org/rfc/rfc3987#section-2.2">RFC 3987</a>,
     * these characters delimit URI components and a {@code %}-escape of any of them must
     * never be decoded:
     *
     * <pre>
     * gen-delims  = ":" / "/" / "?" / "#" / "[" / "]" / "@"
     * sub-delims  = "!" / "$" / "&amp;" / "'" / "(" / ")"
     *             / "*" / "+" / "," / ";" / "="
     * </pre>
     */
    private static final String RESERVED = ":/?#[]@" + "!$&'()*+,;=";

    static boolean isReserved(int octet) {
        return octet < 128 && RESERVED.indexOf(octet) >= 0;
    }

    static byte hexValue(char c) {
        if (c >= '0' && c <= '9')
            return (byte)(c-'0');
        else if (c >= 'A' && c <= 'F')
            return (byte)(10+c-'A');
        else if (c >= 'a' && c <= 'f')
            return (byte)(10+c-'a');
        return -1;
    }

    /**
     * Whether {@code cp} is a graphic code point: a letter, mark, number, punctuation,
     * symbol or space separator. Control, format, line/paragraph separators, private use,
     * surrogates and unassigned code points are not graphic.
     */
    static boolean isGraphic(int cp) {
        return switch (Character.getType(cp)) {
            case Character.UPPERCASE_LETTER, Character.LOWERCASE_LETTER,
                 Character.TITLECASE_LETTER, Character.MODIFIER_LETTER, Character.OTHER_LETTER,
                 Character.NON_SPACING_MARK, Character.ENCLOSING_MARK,
                 Character.COMBINING_SPACING_MARK,
                 Character.DECIMAL_DIGIT_NUMBER, Character.LETTER_NUMBER,
                 Character.OTHER_NUMBER,
                 Character.CONNECTOR_PUNCTUATION, Character.DASH_PUNCTUATION,
                 Character.START_PUNCTUATION, Character.END_PUNCTUATION,
                 Character.INITIAL_QUOTE_PUNCTUATION, Character.FINAL_QUOTE_PUNCTUATION,
                 Character.OTHER_PUNCTUATION,
                 Character.MATH_SYMBOL, Character.CURRENCY_SYMBOL, Character.MODIFIER_SYMBOL,
                 Character.OTHER_SYMBOL,
                 Character.SPACE_SEPARATOR -> true;
            default -> false;
        };
    }

    /**
     * Converts a URI into an IRI as described in
     * <a href="https://www.rfc-editor.org/rfc/rfc3987#section-3.2">RFC 3987 section 3.2</a>.
     *
     * <p>Every valid {@code %XX} escape is decoded unless the octet is a reserved
     * delimiter (see {@link UriUtils#RESERVED}), in which case the escape is kept as it
     * appears in {@code uri}. Decoded octets are re-assembled as UTF-8 and any resulting
     * code point that is not graphic, as well as any octet that does not take part in a
     * valid UTF-8 sequence, is (re-)escaped with upper case hex digits. Malformed escapes
     * ({@code %%}, {@code %zz} or a truncated {@code %A} at the end) are copied verbatim.</p>
     *
     * @param uri a URI with (possibly) percent-escaped octets
     * @return the IRI form of {@code uri}. If nothing changes, {@code uri} itself
     */
    public static String decode(String uri) {
        if (!needsDecode(uri))
            return uri;
        int len = uri.length();
        Decoder decoder = new Decoder(len);
        for (int i = 0; i < len; ) {
            char c = uri.charAt(i);
            byte hi, lo;
            if (c == '%' && i+2 < len && (hi = hexValue(uri.charAt(i+1))) >= 0
                                      && (lo = hexValue(uri.charAt(i+2))) >= 0) {
                int octet = hi << 4 | lo;
                if (isReserved(octet)) decoder.verbatim(uri, i, i+3);
                else                   decoder.octet(octet);
                i += 3;
            } else {
                if (c == '%')
                    log.trace("Malformed %-escape at index {} of {}, will not decode", i, uri);
                int cp = uri.codePointAt(i);
                decoder.codePoint(cp);
                i += Character.charCount(cp);
            }
        }
        return decoder.finish();
    }

    private static boolean needsDecode(String uri) {
        for (int i = 0, len = uri.length(); i < len; ) {
            int cp = uri.codePointAt(i);
            if (cp == '%' || !isGraphic(cp))
                return true;
            i += Character.charCount(cp);
        }
        return false;
    }

    private static void escape(StringBuilder out, int octet) {
        out.append('%').append(HEX[(octet&0xF0) >> 4]).append(HEX[octet&0x0F]);
    }

    private static final class Decoder {
        private final StringBuilder out;
        /** Octets of a UTF-8 sequence that is still missing continuation octets. */
        private final byte[] pending = new byte[4];
        private int pendingLen, pendingNeed;

        Decoder(int capacity) { out = new StringBuilder(capacity); }

        void verbatim(String src, int begin, int end) {
            flushPending();
            out.append(src, begin, end);
        }

        void codePoint(int cp) {
            flushPending();
            if (isGraphic(cp)) {
                out.appendCodePoint(cp);
            } else if (cp < 0x80) {
                escape(out, cp);
            } else if (cp < 0x800) {
                escape(out, 0xC0 | (cp >> 6));
                escape(out, 0x80 | (cp & 0x3F));
            } else if (cp < 0x10000) {
                escape(out, 0xE0 | (cp >> 12));
                escape(out, 0x80 | ((cp >> 6) & 0x3F));
                escape(out, 0x80 | (cp & 0x3F));
            } else {
                escape(out, 0xF0 | (cp >> 18));
                escape(out, 0x80 | ((cp >> 12) & 0x3F));
                escape(out, 0x80 | ((cp >> 6) & 0x3F));
                escape(out, 0x80 | (cp & 0x3F));
            }
        }

        void octet(int octet) {
            if (pendingLen > 0) {
                if (continuesPending(octet)) {
                    pending[pendingLen++] = (byte)octet;
                    if (pendingLen == pendingNeed)
                        completePending();
                    return;
                }
                flushPending();
            }
            int need = sequenceLength(octet);
            if (octet < 0x80) {
                codePoint(octet);
            } else if (need > 1) {
                pending[0] = (byte)octet;
                pendingLen = 1;
                pendingNeed = need;
            } else {
                escape(out, octet); // stray continuation or never-valid lead octet
            }
        }

        String finish() {
            flushPending();
            return out.toString();
        }

        private static int sequenceLength(int lead) {
            if (lead >= 0xC2 && lead <= 0xDF) return 2;
            if (lead >= 0xE0 && lead <= 0xEF) return 3;
            if (lead >= 0xF0 && lead <= 0xF4) return 4;
            return 0;
        }

        /** Rejects continuations that would yield overlong forms, surrogates or cp > 0x10FFFF */
        private boolean continuesPending(int octet) {
            if ((octet & 0xC0) != 0x80)
                return false;
            if (pendingLen > 1)
                return true;
            return switch (pending[0] & 0xFF) {
                case 0xE0 -> octet >= 0xA0;
                case 0xED -> octet <  0xA0;
                case 0xF0 -> octet >= 0x90;
                case 0xF4 -> octet <  0x90;
                default   -> true;
            };
        }

        private void completePending() {
            int cp = pending[0] & (0xFF >> (pendingNeed+1));
            for (int i = 1; i < pendingNeed; i++)
                cp = cp << 6 | (pending[i] & 0x3F);
            if (isGraphic(cp)) {
                out.appendCodePoint(cp);
            } else {
                for (int i = 0; i < pendingNeed; i++)
                    escape(out, pending[i] & 0xFF);
            }
            pendingLen = pendingNeed = 0;
        }

        /** Escapes octets of an incomplete UTF-8 sequence. */
        private void flushPending() {
            if (pendingLen == 0)
                return;
            for (int i = 0; i < pendingLen; i++)
                escape(out, pending[i] & 0xFF);
            pendingLen = pendingNeed = 0;
        }
    }
}

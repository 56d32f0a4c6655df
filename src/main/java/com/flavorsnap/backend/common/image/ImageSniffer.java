package com.flavorsnap.backend.common.image;

import java.io.IOException;
import java.io.PushbackInputStream;
import java.util.Arrays;

/**
 * Magic-byte detection for the image formats the app accepts
 * (png, jpg/jpeg, gif, bmp, webp). File names and declared content types are not trusted.
 */
public final class ImageSniffer {

    public static final int HEAD_BYTES = 16;

    private ImageSniffer() {}

    public enum ImageType {
        JPEG("image/jpeg", ".jpg"),
        PNG("image/png", ".png"),
        GIF("image/gif", ".gif"),
        BMP("image/bmp", ".bmp"),
        WEBP("image/webp", ".webp");

        private final String contentType;
        private final String ext;

        ImageType(String contentType, String ext) {
            this.contentType = contentType;
            this.ext = ext;
        }

        public String contentType() { return contentType; }
        public String ext() { return ext; }
    }

    public record Detection(ImageType type) {
        public String contentType() { return type.contentType(); }
        public String ext() { return type.ext(); }
    }

    private static final byte[] PNG_SIG = {
            (byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A
    };
    private static final byte[] GIF87 = {'G', 'I', 'F', '8', '7', 'a'};
    private static final byte[] GIF89 = {'G', 'I', 'F', '8', '9', 'a'};
    private static final byte[] RIFF = {'R', 'I', 'F', 'F'};
    private static final byte[] WEBP = {'W', 'E', 'B', 'P'};

    /**
     * 會讀取最多 16 bytes 作判斷，然後 push back 回去（不影響後續存檔）
     * stream 的 pushback buffer 至少要 {@link #HEAD_BYTES}
     */
    public static Detection detect(PushbackInputStream in) throws IOException {
        byte[] head = new byte[HEAD_BYTES];
        int n = in.readNBytes(head, 0, HEAD_BYTES);
        if (n <= 0) return null;
        in.unread(head, 0, n);
        return detect(head, n);
    }

    public static Detection detect(byte[] head, int n) {
        if (startsWith(head, n, PNG_SIG)) return new Detection(ImageType.PNG);

        // JPEG：FF D8 FF
        if (n >= 3 && head[0] == (byte) 0xFF && head[1] == (byte) 0xD8 && head[2] == (byte) 0xFF) {
            return new Detection(ImageType.JPEG);
        }
        if (startsWith(head, n, GIF87) || startsWith(head, n, GIF89)) return new Detection(ImageType.GIF);

        // BMP：'B' 'M' + 4 bytes 檔案大小，太短的不算
        if (n >= 6 && head[0] == 'B' && head[1] == 'M') return new Detection(ImageType.BMP);

        // WEBP：RIFF....WEBP
        if (n >= 12 && startsWith(head, n, RIFF)
                && Arrays.equals(Arrays.copyOfRange(head, 8, 12), WEBP)) {
            return new Detection(ImageType.WEBP);
        }
        return null;
    }

    private static boolean startsWith(byte[] buf, int n, byte[] prefix) {
        if (n < prefix.length) return false;
        return Arrays.equals(Arrays.copyOfRange(buf, 0, prefix.length), prefix);
    }
}

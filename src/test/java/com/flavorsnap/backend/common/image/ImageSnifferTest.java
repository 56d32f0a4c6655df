package com.flavorsnap.backend.common.image;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.PushbackInputStream;

import static org.junit.jupiter.api.Assertions.*;

class ImageSnifferTest {

    private static ImageSniffer.Detection sniff(byte[] head) {
        return ImageSniffer.detect(head, head.length);
    }

    @Test
    void detects_every_accepted_format() {
        assertEquals(ImageSniffer.ImageType.JPEG,
                sniff(new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0x00}).type());
        assertEquals(ImageSniffer.ImageType.PNG,
                sniff(new byte[]{(byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A}).type());
        assertEquals(ImageSniffer.ImageType.GIF, sniff("GIF89a....".getBytes()).type());
        assertEquals(ImageSniffer.ImageType.BMP, sniff(new byte[]{'B', 'M', 0, 0, 0, 0}).type());
        assertEquals(ImageSniffer.ImageType.WEBP, sniff("RIFF\0\0\0\0WEBPVP8 ".getBytes()).type());
    }

    @Test
    void rejects_non_images_and_truncated_headers() {
        assertNull(sniff("hello world".getBytes()));
        assertNull(sniff(new byte[]{'B', 'M'}));
        assertNull(sniff("RIFF\0\0\0\0WAVE".getBytes()));
        assertNull(sniff(new byte[0]));
    }

    @Test
    void stream_detection_pushes_bytes_back() throws Exception {
        byte[] png = {(byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A, 1, 2, 3};
        PushbackInputStream in = new PushbackInputStream(new ByteArrayInputStream(png), ImageSniffer.HEAD_BYTES);

        ImageSniffer.Detection d = ImageSniffer.detect(in);

        assertEquals("image/png", d.contentType());
        assertEquals(".png", d.ext());
        assertArrayEquals(png, in.readAllBytes());
    }
}

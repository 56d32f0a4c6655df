package com.flavorsnap.backend.common.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Base64;

/** Opaque token = URL-safe Base64 (no padding) of the cursor's JSON form. */
@Slf4j
public class CursorCodec {

    private final ObjectMapper om;

    public CursorCodec(ObjectMapper om) {
        this.om = om;
    }

    public String encode(Cursor cursor) {
        try {
            return Base64.getUrlEncoder().withoutPadding().encodeToString(om.writeValueAsBytes(cursor));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("CURSOR_ENCODE_FAILED", e);
        }
    }

    /** 壞掉的 cursor 一律當作沒帶（回 null），不要丟 400 */
    public Cursor decodeOrNull(String token) {
        if (token == null || token.isBlank()) return null;
        try {
            byte[] json = Base64.getUrlDecoder().decode(token.trim());
            Cursor c = om.readValue(json, Cursor.class);
            if (c == null || (!c.isAfter() && !c.isBefore())) return null;
            if (c.isAfter() && c.id() == null) return null;
            return c;
        } catch (IllegalArgumentException | IOException e) {
            log.debug("cursor_invalid token={} error={}", token, e.getClass().getSimpleName());
            return null;
        }
    }
}

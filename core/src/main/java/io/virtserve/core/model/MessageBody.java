package io.virtserve.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Raw request body plus its {@link MediaType}.
 *
 * <p>
 * The record overrides {@code equals}/{@code hashCode} to compare byte content (records use
 * reference equality for arrays by default).
 */
public record MessageBody(byte[] content, MediaType mediaType) {

    private static final MessageBody EMPTY = new MessageBody(new byte[0], MediaType.NONE);

    /** Normalizes null content to an empty byte array. */
    public MessageBody {
        if (content == null) {
            content = new byte[0];
        }
        Objects.requireNonNull(mediaType, "mediaType must not be null; use MediaType.NONE for absent types");
    }

    /** True when content is zero-length. */
    public boolean isEmpty() {
        return content.length == 0;
    }

    /** Returns content as a UTF-8 string. */
    public String asString() {
        return new String(content, StandardCharsets.UTF_8);
    }

    /** Content length in bytes. */
    public int size() {
        return content.length;
    }

    // ── Factory methods ──

    /** Creates a body from a string (UTF-8 encoded). */
    public static MessageBody of(String content, MediaType mediaType) {
        return new MessageBody(content != null ? content.getBytes(StandardCharsets.UTF_8) : new byte[0], mediaType);
    }

    /** Creates a JSON body from a string. */
    public static MessageBody json(String content) {
        return of(content, MediaType.JSON);
    }

    /** Returns an empty body (no content, {@link MediaType#NONE}). */
    public static MessageBody empty() {
        return EMPTY;
    }

    // ── equals / hashCode (byte-content-aware) ──

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageBody that)) return false;
        return mediaType == that.mediaType && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(content) + mediaType.hashCode();
    }

    @Override
    public String toString() {
        return "MessageBody[" + mediaType + ", " + content.length + " bytes]";
    }
}

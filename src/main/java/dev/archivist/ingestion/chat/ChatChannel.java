package dev.archivist.ingestion.chat;

/**
 * A chat channel.
 *
 * @param id platform channel id, e.g. {@code C0123456}
 * @param name channel name without the leading {@code #}
 */
public record ChatChannel(String id, String name) {}

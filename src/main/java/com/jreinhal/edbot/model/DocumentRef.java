package com.jreinhal.edbot.model;

/**
 * Reference to a whole document resolved by keyword, used for form retrieval.
 *
 * @param documentId stable identifier, usually the filename
 * @param displayName human readable title
 * @param matchedKeyword the index keyword that selected this document
 */
public record DocumentRef(String documentId, String displayName, String matchedKeyword) {
}

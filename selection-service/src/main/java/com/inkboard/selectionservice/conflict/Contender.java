package com.inkboard.selectionservice.conflict;

/**
 * One user competing for an element.
 */
public record Contender(String userId, String displayName, int priority, long timestamp) {
}

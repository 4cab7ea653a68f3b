package com.eainde.research.gateway;

/**
 * The kinds of external operation the gateway mediates.
 */
public enum CallKind {
    GENERATE_TEXT,
    WEB_SEARCH
}

package com.questrail.goldenbridge.model;

/**
 * Raised when the same argument key appears twice in one request, after
 * keys have been normalized to their string form.
 */
public final class DuplicateArgumentException extends InvalidRequestException
{
    private final String module;
    private final String key;

    public DuplicateArgumentException(String module, String key) {
        super("Duplicate argument key '" + key + "' in request for module " + module);
        this.module = module;
        this.key = key;
    }

    public String module() {
        return module;
    }

    public String key() {
        return key;
    }
}

package com.questrail.bamboo.api;

/**
 * Main-frame load completion or failure.
 *
 * @param httpStatus HTTP status on success, engine error code on failure
 * @param errorText  empty unless {@code error} is set
 */
public record LoadEvent(String url, int httpStatus, boolean error, String errorText)
{
    public static LoadEvent completed(String url, int httpStatus) {
        return new LoadEvent(url, httpStatus, false, "");
    }

    public static LoadEvent failed(String url, int errorCode, String errorText) {
        return new LoadEvent(url, errorCode, true, errorText == null ? "" : errorText);
    }
}

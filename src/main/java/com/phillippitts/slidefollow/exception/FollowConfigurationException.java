package com.phillippitts.slidefollow.exception;

/**
 * Thrown when follow settings are out of range. Raised while settings are built, never by
 * the follow engine itself.
 */
public class FollowConfigurationException extends SlideFollowException {

    private final String setting;

    public FollowConfigurationException(String setting, String problem) {
        super("Invalid follow setting '" + setting + "': " + problem);
        this.setting = setting;
    }

    public String getSetting() {
        return setting;
    }
}

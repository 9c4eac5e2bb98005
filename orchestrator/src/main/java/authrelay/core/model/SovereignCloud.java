package authrelay.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Sovereign clouds that can be selected by name instead of by login URL.
 */
public enum SovereignCloud {
    AZURE_CHINA("Azure China", "https://login.chinacloudapi.cn/"),
    AZURE_US_GOVERNMENT("Azure US Government", "https://login.microsoftonline.us/");

    private final String displayName;
    private final String loginUrl;

    SovereignCloud(String displayName, String loginUrl) {
        this.displayName = displayName;
        this.loginUrl = loginUrl;
    }

    public String displayName() {
        return displayName;
    }

    public String loginUrl() {
        return loginUrl;
    }

    /**
     * Find the cloud whose name exactly matches a configuration value.
     *
     * @param settingValue the raw configuration value
     * @return the matching cloud, or empty for anything else (including case variants)
     */
    public static Optional<SovereignCloud> fromSettingValue(String settingValue) {
        return Arrays.stream(values())
                .filter(cloud -> cloud.displayName.equals(settingValue))
                .findFirst();
    }
}

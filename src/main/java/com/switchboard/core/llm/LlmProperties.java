package com.switchboard.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "switchboard.llm")
public class LlmProperties {

    private boolean enabled = true;
    private String provider = "openai";
    private String openaiApiKey = "";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getOpenaiApiKey() {
        return openaiApiKey;
    }

    public void setOpenaiApiKey(String openaiApiKey) {
        this.openaiApiKey = openaiApiKey;
    }

    public boolean hasOpenaiKey() {
        return openaiApiKey != null && !openaiApiKey.isBlank() && !"not-configured".equals(openaiApiKey);
    }
}

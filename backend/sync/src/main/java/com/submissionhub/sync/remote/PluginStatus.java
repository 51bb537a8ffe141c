package com.submissionhub.sync.remote;

public record PluginStatus(boolean installed, boolean active, String version) {
    public static PluginStatus notInstalled() {
        return new PluginStatus(false, false, null);
    }
}

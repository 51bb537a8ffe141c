package com.submissionhub.sync.diagnostics;

public record DiagnosticsReport(long siteId, SiteCheck site, PluginApiCheck pluginApi, PluginCheck plugin) {

    public record SiteCheck(boolean reachable, String name, String error) {
    }

    public record PluginApiCheck(boolean active, String error) {
        static PluginApiCheck skipped() {
            return new PluginApiCheck(false, "Skipped: site not reachable");
        }
    }

    public record PluginCheck(boolean installed, boolean active, String version, String error) {
        static PluginCheck skipped() {
            return new PluginCheck(false, false, null, "Skipped: site not reachable");
        }
    }

    public boolean healthy() {
        return site.reachable() && pluginApi.active() && plugin.active();
    }
}

package com.ideatrack.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "ideatrack")
public class IdeaTrackProperties {

    private Lineage lineage = new Lineage();
    private Backprop backprop = new Backprop();
    private Storage storage = new Storage();
    private Notification notification = new Notification();
    private History history = new History();

    public Lineage getLineage() { return lineage; }
    public void setLineage(Lineage lineage) { this.lineage = lineage; }

    public Backprop getBackprop() { return backprop; }
    public void setBackprop(Backprop backprop) { this.backprop = backprop; }

    public Storage getStorage() { return storage; }
    public void setStorage(Storage storage) { this.storage = storage; }

    public Notification getNotification() { return notification; }
    public void setNotification(Notification notification) { this.notification = notification; }

    public History getHistory() { return history; }
    public void setHistory(History history) { this.history = history; }

    public static class Lineage {
        /** Safety bound for a single ancestor walk. */
        private int maxAncestorDepth = 1000;

        public int getMaxAncestorDepth() { return maxAncestorDepth; }
        public void setMaxAncestorDepth(int maxAncestorDepth) { this.maxAncestorDepth = maxAncestorDepth; }
    }

    public static class Backprop {
        /** Credit fraction per hop: an ancestor at distance d receives factor^d. */
        private double depthDecayFactor = 0.5;

        public double getDepthDecayFactor() { return depthDecayFactor; }
        public void setDepthDecayFactor(double depthDecayFactor) { this.depthDecayFactor = depthDecayFactor; }
    }

    public static class Storage {
        /** JSON snapshot file; blank keeps everything in memory. */
        private String snapshotPath = "";

        public String getSnapshotPath() { return snapshotPath; }
        public void setSnapshotPath(String snapshotPath) { this.snapshotPath = snapshotPath; }
    }

    public static class Notification {
        /** Minimum reputationScore delta reported as a profile change. */
        private double profileChangeThreshold = 0.01;

        public double getProfileChangeThreshold() { return profileChangeThreshold; }
        public void setProfileChangeThreshold(double profileChangeThreshold) { this.profileChangeThreshold = profileChangeThreshold; }
    }

    public static class History {
        /** Upper bound on retained history events; the oldest are dropped first. */
        private int maxEvents = 10000;

        public int getMaxEvents() { return maxEvents; }
        public void setMaxEvents(int maxEvents) { this.maxEvents = maxEvents; }
    }
}

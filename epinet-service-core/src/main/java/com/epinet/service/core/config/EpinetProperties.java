package com.epinet.service.core.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "epinet")
public class EpinetProperties {
    private Load load = new Load();
    private View view = new View();
    private Refresh refresh = new Refresh();

    public Load getLoad() {
        return load;
    }

    public void setLoad(Load load) {
        this.load = load;
    }

    public View getView() {
        return view;
    }

    public void setView(View view) {
        this.view = view;
    }

    public Refresh getRefresh() {
        return refresh;
    }

    public void setRefresh(Refresh refresh) {
        this.refresh = refresh;
    }

    public static class Load {
        private Duration throttle = Duration.ofSeconds(60);
        private int recentChunkHours = 48;
        private int historicalChunkHours = 168;
        private int maxAnalyticsHours = 672;
        private Duration chunkPause = Duration.ofMillis(10);
        private int workers = 4;

        public Duration getThrottle() {
            return throttle;
        }

        public void setThrottle(Duration throttle) {
            this.throttle = throttle;
        }

        public int getRecentChunkHours() {
            return recentChunkHours;
        }

        public void setRecentChunkHours(int recentChunkHours) {
            this.recentChunkHours = Math.max(1, recentChunkHours);
        }

        public int getHistoricalChunkHours() {
            return historicalChunkHours;
        }

        public void setHistoricalChunkHours(int historicalChunkHours) {
            this.historicalChunkHours = Math.max(1, historicalChunkHours);
        }

        public int getMaxAnalyticsHours() {
            return maxAnalyticsHours;
        }

        public void setMaxAnalyticsHours(int maxAnalyticsHours) {
            this.maxAnalyticsHours = Math.max(1, maxAnalyticsHours);
        }

        public Duration getChunkPause() {
            return chunkPause;
        }

        public void setChunkPause(Duration chunkPause) {
            this.chunkPause = chunkPause;
        }

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = Math.max(1, workers);
        }
    }

    public static class View {
        private int maxSankeyNodes = 16;

        public int getMaxSankeyNodes() {
            return maxSankeyNodes;
        }

        public void setMaxSankeyNodes(int maxSankeyNodes) {
            this.maxSankeyNodes = Math.max(1, maxSankeyNodes);
        }
    }

    public static class Refresh {
        private boolean enabled = true;
        private long rateMillis = 60000;
        private List<String> tenants = new ArrayList<>(List.of("default"));

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getRateMillis() {
            return rateMillis;
        }

        public void setRateMillis(long rateMillis) {
            this.rateMillis = rateMillis;
        }

        public List<String> getTenants() {
            return tenants;
        }

        public void setTenants(List<String> tenants) {
            this.tenants = tenants;
        }
    }
}

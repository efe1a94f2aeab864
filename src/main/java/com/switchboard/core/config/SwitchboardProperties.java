package com.switchboard.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "switchboard")
public class SwitchboardProperties {

    private Catalog catalog = new Catalog();
    private Training training = new Training();
    private Resolver resolver = new Resolver();
    private Cache cache = new Cache();

    // -- Flattened accessors --
    public String getCatalogLocation() { return catalog.location; }
    public String getTrainingLocation() { return training.location; }
    public double getGenericAcceptThreshold() { return resolver.genericAcceptThreshold; }
    public double getCrossPlatformAcceptThreshold() { return resolver.crossPlatformAcceptThreshold; }
    public Duration getGenerativeTimeout() { return resolver.generativeTimeout; }
    public Duration getCacheTtl() { return cache.ttl; }

    public Catalog getCatalog() { return catalog; }
    public void setCatalog(Catalog catalog) { this.catalog = catalog; }
    public Training getTraining() { return training; }
    public void setTraining(Training training) { this.training = training; }
    public Resolver getResolver() { return resolver; }
    public void setResolver(Resolver resolver) { this.resolver = resolver; }
    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }

    public static class Catalog {
        /** JSON file of the form {@code {"intents":[...]}}; blank means built-in defaults. */
        private String location = "";

        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }
    }

    public static class Training {
        private String location = "./data/training-examples.json";

        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }
    }

    public static class Resolver {
        private double genericAcceptThreshold = 0.9;
        private double crossPlatformAcceptThreshold = 0.8;
        private Duration generativeTimeout = Duration.ofSeconds(10);
        private int generativeThreads = 4;

        public double getGenericAcceptThreshold() { return genericAcceptThreshold; }
        public void setGenericAcceptThreshold(double genericAcceptThreshold) { this.genericAcceptThreshold = genericAcceptThreshold; }
        public double getCrossPlatformAcceptThreshold() { return crossPlatformAcceptThreshold; }
        public void setCrossPlatformAcceptThreshold(double crossPlatformAcceptThreshold) { this.crossPlatformAcceptThreshold = crossPlatformAcceptThreshold; }
        public Duration getGenerativeTimeout() { return generativeTimeout; }
        public void setGenerativeTimeout(Duration generativeTimeout) { this.generativeTimeout = generativeTimeout; }
        public int getGenerativeThreads() { return generativeThreads; }
        public void setGenerativeThreads(int generativeThreads) { this.generativeThreads = generativeThreads; }
    }

    public static class Cache {
        private Duration ttl = Duration.ofMinutes(5);

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }
    }
}

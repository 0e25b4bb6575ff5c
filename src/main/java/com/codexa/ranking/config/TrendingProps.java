package com.codexa.ranking.config;

import com.codexa.ranking.trending.TrendingModels.HotScoreConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "ranking.trending")
public class TrendingProps {
    private double likesWeight = 2;
    private double commentsWeight = 3;
    private double readsWeight = 1;
    private double decayConstantDays = 7;
    private double gravity = 1.8;
    private double verifiedAuthorBoost = 1.1;
    private double qualityThreshold = 70;
    private double qualityBoostPerTenPoints = 0.05;
    private int defaultLimit = 20;

    public HotScoreConfig toConfig() {
        return new HotScoreConfig(likesWeight, commentsWeight, readsWeight, decayConstantDays, gravity,
                verifiedAuthorBoost, qualityThreshold, qualityBoostPerTenPoints);
    }

    public double getLikesWeight() { return likesWeight; }
    public void setLikesWeight(double likesWeight) { this.likesWeight = likesWeight; }
    public double getCommentsWeight() { return commentsWeight; }
    public void setCommentsWeight(double commentsWeight) { this.commentsWeight = commentsWeight; }
    public double getReadsWeight() { return readsWeight; }
    public void setReadsWeight(double readsWeight) { this.readsWeight = readsWeight; }
    public double getDecayConstantDays() { return decayConstantDays; }
    public void setDecayConstantDays(double decayConstantDays) { this.decayConstantDays = decayConstantDays; }
    public double getGravity() { return gravity; }
    public void setGravity(double gravity) { this.gravity = gravity; }
    public double getVerifiedAuthorBoost() { return verifiedAuthorBoost; }
    public void setVerifiedAuthorBoost(double verifiedAuthorBoost) { this.verifiedAuthorBoost = verifiedAuthorBoost; }
    public double getQualityThreshold() { return qualityThreshold; }
    public void setQualityThreshold(double qualityThreshold) { this.qualityThreshold = qualityThreshold; }
    public double getQualityBoostPerTenPoints() { return qualityBoostPerTenPoints; }
    public void setQualityBoostPerTenPoints(double qualityBoostPerTenPoints) { this.qualityBoostPerTenPoints = qualityBoostPerTenPoints; }
    public int getDefaultLimit() { return defaultLimit; }
    public void setDefaultLimit(int defaultLimit) { this.defaultLimit = defaultLimit; }
}

package com.codexa.ranking.config;

import com.codexa.ranking.recommendation.RecommendationModels.SimilarityConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "ranking.similarity")
public class SimilarityProps {
    private double likesWeight = 0.3;
    private double commentsWeight = 0.5;
    private double readsWeight = 0.2;
    private double maxRecencyPenalty = 0.2;
    private double recencyHorizonDays = 365;
    private int seedArticleLimit = 5;
    private double candidateWindowDays = 365;
    private int relatedLimit = 5;
    private int userLimit = 10;

    public SimilarityConfig toConfig() {
        return new SimilarityConfig(likesWeight, commentsWeight, readsWeight,
                maxRecencyPenalty, recencyHorizonDays, seedArticleLimit, candidateWindowDays);
    }

    public double getLikesWeight() { return likesWeight; }
    public void setLikesWeight(double likesWeight) { this.likesWeight = likesWeight; }
    public double getCommentsWeight() { return commentsWeight; }
    public void setCommentsWeight(double commentsWeight) { this.commentsWeight = commentsWeight; }
    public double getReadsWeight() { return readsWeight; }
    public void setReadsWeight(double readsWeight) { this.readsWeight = readsWeight; }
    public double getMaxRecencyPenalty() { return maxRecencyPenalty; }
    public void setMaxRecencyPenalty(double maxRecencyPenalty) { this.maxRecencyPenalty = maxRecencyPenalty; }
    public double getRecencyHorizonDays() { return recencyHorizonDays; }
    public void setRecencyHorizonDays(double recencyHorizonDays) { this.recencyHorizonDays = recencyHorizonDays; }
    public int getSeedArticleLimit() { return seedArticleLimit; }
    public void setSeedArticleLimit(int seedArticleLimit) { this.seedArticleLimit = seedArticleLimit; }
    public double getCandidateWindowDays() { return candidateWindowDays; }
    public void setCandidateWindowDays(double candidateWindowDays) { this.candidateWindowDays = candidateWindowDays; }
    public int getRelatedLimit() { return relatedLimit; }
    public void setRelatedLimit(int relatedLimit) { this.relatedLimit = relatedLimit; }
    public int getUserLimit() { return userLimit; }
    public void setUserLimit(int userLimit) { this.userLimit = userLimit; }
}

package com.codexa.ranking.config;

import com.codexa.ranking.search.SearchModels.Bm25Config;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "ranking.bm25")
public class Bm25Props {
    private double k1 = 1.5;
    private double b = 0.75;
    private double titleBoost = 2.0;
    private double subtitleBoost = 1.5;
    private double tagBoost = 1.3;
    private int defaultLimit = 20;

    public Bm25Config toConfig() {
        return new Bm25Config(k1, b, titleBoost, subtitleBoost, tagBoost);
    }

    public double getK1() { return k1; }
    public void setK1(double k1) { this.k1 = k1; }
    public double getB() { return b; }
    public void setB(double b) { this.b = b; }
    public double getTitleBoost() { return titleBoost; }
    public void setTitleBoost(double titleBoost) { this.titleBoost = titleBoost; }
    public double getSubtitleBoost() { return subtitleBoost; }
    public void setSubtitleBoost(double subtitleBoost) { this.subtitleBoost = subtitleBoost; }
    public double getTagBoost() { return tagBoost; }
    public void setTagBoost(double tagBoost) { this.tagBoost = tagBoost; }
    public int getDefaultLimit() { return defaultLimit; }
    public void setDefaultLimit(int defaultLimit) { this.defaultLimit = defaultLimit; }
}

package com.ospicorp.indicatormetrics.indicator.catalog;

import com.ospicorp.indicatormetrics.indicator.model.IndicatorType;
import com.ospicorp.indicatormetrics.indicator.model.ProviderKind;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "indicators")
public class IndicatorCatalogProperties {

  private List<Entry> catalog = new ArrayList<>();

  public List<Entry> getCatalog() {
    return catalog;
  }

  public void setCatalog(List<Entry> catalog) {
    this.catalog = catalog;
  }

  public static class Entry {
    private String country;
    private IndicatorType indicator;
    private ProviderKind provider;
    private String seriesId;
    private String providerCountry;
    private String label;

    public Entry() {
      // binder default constructor
    }

    public Entry(String country, IndicatorType indicator, ProviderKind provider, String seriesId,
        String providerCountry, String label) {
      this.country = country;
      this.indicator = indicator;
      this.provider = provider;
      this.seriesId = seriesId;
      this.providerCountry = providerCountry;
      this.label = label;
    }

    public String getCountry() {
      return country;
    }

    public void setCountry(String country) {
      this.country = country;
    }

    public IndicatorType getIndicator() {
      return indicator;
    }

    public void setIndicator(IndicatorType indicator) {
      this.indicator = indicator;
    }

    public ProviderKind getProvider() {
      return provider;
    }

    public void setProvider(ProviderKind provider) {
      this.provider = provider;
    }

    public String getSeriesId() {
      return seriesId;
    }

    public void setSeriesId(String seriesId) {
      this.seriesId = seriesId;
    }

    public String getProviderCountry() {
      return providerCountry;
    }

    public void setProviderCountry(String providerCountry) {
      this.providerCountry = providerCountry;
    }

    public String getLabel() {
      return label;
    }

    public void setLabel(String label) {
      this.label = label;
    }
  }
}

package com.hotelintel.sampler.driver;

import com.hotelintel.sampler.config.SamplerProperties;
import com.hotelintel.sampler.model.SamplingPlan;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Builds search and detail URLs for the listing site.
 * Search dates default to a one-night stay starting tomorrow.
 */
@Component
@RequiredArgsConstructor
public class SourceUrls {

    private final SamplerProperties properties;
    private final Clock clock;

    public String searchUrl(String cityCode, SamplingPlan.Zone zone, SamplingPlan.PriceTier tier) {
        LocalDate checkIn = LocalDate.now(clock).plusDays(1);
        return UriComponentsBuilder
                .fromHttpUrl(properties.getSource().getListUrl())
                .queryParam("city", cityOrDefault(cityCode))
                .queryParam("checkIn", checkIn)
                .queryParam("checkOut", checkIn.plusDays(1))
                .queryParam("businessZone", zone.code())
                .queryParam("priceRange", tier.min() + "-" + tier.max())
                .toUriString();
    }

    public String detailUrl(String itemId) {
        return UriComponentsBuilder
                .fromHttpUrl(properties.getSource().getDetailUrl())
                .queryParam("shid", itemId)
                .queryParam("city", properties.getSource().getCityCode())
                .toUriString();
    }

    private String cityOrDefault(String cityCode) {
        return cityCode != null ? cityCode : properties.getSource().getCityCode();
    }
}

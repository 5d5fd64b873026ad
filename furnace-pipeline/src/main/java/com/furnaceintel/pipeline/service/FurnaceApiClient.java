package com.furnaceintel.pipeline.service;

import com.furnaceintel.pipeline.config.FurnacePipelineProperties;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;
import org.w3c.dom.Document;
import org.xml.sax.InputSource;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.StringReader;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Thin client over the blast furnace data API.
 *
 * Both endpoints answer with a single XML {@code <string>} element whose text is the payload
 * literal. Failures are retried by Resilience4j (instances furnaceLive and furnaceDaily);
 * once retries are exhausted the last {@link FetchException} reaches the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FurnaceApiClient implements FurnaceDataSource {

    private final RestTemplate restTemplate;
    private final FurnacePipelineProperties properties;

    @Override
    @Retry(name = "furnaceLive")
    public String fetchLive() {
        FurnacePipelineProperties.Api api = properties.getApi();
        String url = UriComponentsBuilder
                .fromHttpUrl(api.getLiveUrl())
                .queryParam("user", api.getLiveUser())
                .queryParam("password", api.getLivePassword())
                .toUriString();

        log.info("Fetching live data");
        return callApi(url, false);
    }

    @Override
    @Retry(name = "furnaceDaily")
    public String fetchDaily(LocalDate date, int range) {
        FurnacePipelineProperties.Api api = properties.getApi();
        String url = UriComponentsBuilder
                .fromHttpUrl(api.getDailyUrl())
                .queryParam("user", api.getDailyUser())
                .queryParam("password", api.getDailyPassword())
                .queryParam("month", date.getMonthValue())
                .queryParam("day", date.getDayOfMonth())
                .queryParam("year", date.getYear())
                .queryParam("range", range)
                .toUriString();

        log.info("Fetching daily data for {} range {}",
                date.format(DateTimeFormatter.ofPattern(api.getDateFormat())), range);
        return callApi(url, true);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String callApi(String url, boolean requireContent) {
        String body;
        try {
            body = restTemplate.getForObject(url, String.class);
        } catch (RestClientException e) {
            log.error("API call failed: {}", e.getMessage());
            throw new FetchException("Furnace API call failed: " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            throw new FetchException("Furnace API returned an empty body");
        }

        String payload = extractStringElement(body);
        if (requireContent && payload.isBlank()) {
            throw new FetchException("Furnace API response is empty");
        }
        log.debug("API response text: {}...", payload.substring(0, Math.min(100, payload.length())));
        return payload;
    }

    static String extractStringElement(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setNamespaceAware(true);
            Document doc = factory.newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
            return doc.getDocumentElement().getTextContent();
        } catch (Exception e) {
            throw new FetchException("Furnace API response is not an XML string element: " + e.getMessage(), e);
        }
    }
}

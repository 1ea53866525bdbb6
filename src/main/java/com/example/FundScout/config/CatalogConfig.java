package com.example.FundScout.config;

import com.example.FundScout.repository.FundingCatalog;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads the canonical funding CSV once at startup. A missing file yields an empty
 * catalog, which simply disables keyword and field backfill.
 */
@Configuration
public class CatalogConfig {

    private static final Logger log = LoggerFactory.getLogger(CatalogConfig.class);

    @Bean
    public FundingCatalog fundingCatalog(FundingProperties properties, ResourceLoader resourceLoader) throws IOException {
        Resource resource = resourceLoader.getResource(properties.getCatalogPath());
        if (!resource.exists()) {
            log.warn("Funding catalog not found at {}; keyword and field backfill are disabled",
                    properties.getCatalogPath());
            return FundingCatalog.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            FundingCatalog catalog = new FundingCatalog(readRows(in));
            log.info("Loaded funding catalog: {} rows from {}", catalog.size(), properties.getCatalogPath());
            return catalog;
        }
    }

    static List<Map<String, String>> readRows(InputStream in) throws IOException {
        CsvMapper mapper = new CsvMapper();
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Map<String, String>> rows = new ArrayList<>();
        try (MappingIterator<Map<String, String>> it = mapper.readerForMapOf(String.class)
                .with(schema)
                .readValues(in)) {
            while (it.hasNext()) {
                Map<String, String> raw = it.next();
                Map<String, String> row = new LinkedHashMap<>();
                raw.forEach((k, v) -> row.put(k.trim().toLowerCase(Locale.ROOT), v));
                rows.add(row);
            }
        }
        return rows;
    }
}

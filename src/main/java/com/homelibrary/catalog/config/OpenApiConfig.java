package com.homelibrary.catalog.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI homeLibraryOpenAPI(CatalogProperties properties) {
        return new OpenAPI()
            .info(new Info()
                .title("Home Library Catalog API")
                .description("REST API for a personal book catalog: books, authors, publishers, "
                    + "series and taxonomies, with impact previews, orphan cleanup and "
                    + "catalog import/export.")
                .version(properties.getExportFormatVersion()));
    }
}

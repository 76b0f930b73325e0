package com.bank.mulegraph.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI muleGraphFeaturesOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Mule Graph Features API")
                        .version("1.0.0")
                        .description(
                                "Graph-derived risk features for mule-account screening.\n\n" +
                                "**Batch Pipeline:**\n" +
                                "1. Load accounts and transaction edges from the graph store\n" +
                                "2. Project a weighted, undirected account-to-account graph\n" +
                                "3. Detect communities by modularity optimization (Louvain)\n" +
                                "4. Compute community mule density, proximity to confirmed mules and counterparty diversity\n" +
                                "5. Persist and atomically swap in a new feature snapshot generation\n\n" +
                                "**Features:**\n" +
                                "- `muleDensity`: share of confirmed mules in the account's community\n" +
                                "- `distanceToMule`: hops to the nearest confirmed mule (null when out of range)\n" +
                                "- `diversityRatio`: distinct counterparties per transaction\n" +
                                "- `topCounterpartyShare`: share of transactions with the most frequent counterparty\n\n" +
                                "Evaluate a transfer with `GET /evaluations?sourceAccount=..&targetAccount=..`")
                        .contact(new Contact().name("Financial Crime Analytics Team")));
    }
}

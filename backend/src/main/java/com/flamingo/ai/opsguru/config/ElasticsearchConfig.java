package com.flamingo.ai.opsguru.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the turbine document index client. The index is OpenSearch/Elasticsearch
 * compatible and reached through the Apache HttpComponents 5 transport.
 */
@Configuration
public class ElasticsearchConfig {

  @Value("${elasticsearch.host:localhost}")
  private String host;

  @Value("${elasticsearch.port:9200}")
  private int port;

  @Value("${elasticsearch.scheme:http}")
  private String scheme;

  @Value("${elasticsearch.connection-request-timeout-ms:5000}")
  private long connectionRequestTimeoutMs;

  @Value("${elasticsearch.response-timeout-ms:30000}")
  private long responseTimeoutMs;

  @Bean
  public Rest5Client rest5Client() {
    HttpHost httpHost = new HttpHost(scheme, host, port);
    return Rest5Client.builder(httpHost)
        .setRequestConfigCallback(
            config ->
                config
                    .setConnectionRequestTimeout(Timeout.ofMilliseconds(connectionRequestTimeoutMs))
                    .setResponseTimeout(Timeout.ofMilliseconds(responseTimeoutMs)))
        .build();
  }

  @Bean
  public ElasticsearchTransport elasticsearchTransport(Rest5Client rest5Client) {
    return new Rest5ClientTransport(rest5Client, new JacksonJsonpMapper());
  }

  @Bean
  public ElasticsearchClient elasticsearchClient(ElasticsearchTransport transport) {
    return new ElasticsearchClient(transport);
  }
}

package com.example.librarysync.infrastructure.catalog;

import com.example.librarysync.common.config.AppCatalogProperties;
import com.example.librarysync.common.exception.CatalogAuthenticationException;
import com.example.librarysync.common.exception.CatalogTransportException;
import com.example.librarysync.domain.model.CatalogCredentials;
import com.example.librarysync.domain.model.CatalogPage;
import com.example.librarysync.domain.model.CatalogSession;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import javax.annotation.PreDestroy;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpStatus;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class HttpCatalogClient implements CatalogClient {

    private static final Logger log = LoggerFactory.getLogger(HttpCatalogClient.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {
    };

    private final AppCatalogProperties appCatalogProperties;
    private final ObjectMapper objectMapper;
    private final CloseableHttpClient httpClient;

    public HttpCatalogClient(AppCatalogProperties appCatalogProperties, ObjectMapper objectMapper) {
        this.appCatalogProperties = appCatalogProperties;
        this.objectMapper = objectMapper;

        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setMaxTotal(appCatalogProperties.getMaxConnections());
        connectionManager.setDefaultMaxPerRoute(appCatalogProperties.getMaxConnections());
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(appCatalogProperties.getConnectTimeoutMs())
                .setConnectionRequestTimeout(appCatalogProperties.getConnectTimeoutMs())
                .setSocketTimeout(appCatalogProperties.getSocketTimeoutMs())
                .build();
        this.httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(requestConfig)
                .disableCookieManagement()
                .build();
    }

    @Override
    public CatalogSession openSession(CatalogCredentials credentials) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("username", credentials.getUsername());
        body.put("password", credentials.getPassword());

        HttpPost post = new HttpPost(endpoint("/auth/login"));
        post.setEntity(new StringEntity(body.toString(), ContentType.APPLICATION_JSON));
        JsonNode response = execute(post, "login");
        String token = response.path("sessionToken").asText(null);
        if (token == null || token.isEmpty()) {
            throw new CatalogAuthenticationException(HttpStatus.SC_UNAUTHORIZED,
                    "Catalog login returned no session token for user " + credentials.getUsername());
        }
        log.debug("CATALOG_SESSION_OPENED username={}", credentials.getUsername());
        return new CatalogSession(credentials.getUsername(), token);
    }

    @Override
    public CatalogPage fetchPage(CatalogSession session, String continuationToken, int pageSize) {
        HttpGet get;
        try {
            URIBuilder builder = new URIBuilder(endpoint("/tracks"))
                    .addParameter("maxResults", String.valueOf(pageSize));
            if (continuationToken != null) {
                builder.addParameter("pageToken", continuationToken);
            }
            get = new HttpGet(builder.build());
        } catch (URISyntaxException e) {
            throw new CatalogTransportException("Invalid catalog base url: " + appCatalogProperties.getBaseUrl(), e);
        }
        authorize(get, session);

        JsonNode response = execute(get, "fetchPage");
        JsonNode items = response.path("data").path("items");
        List<Map<String, Object>> records;
        if (items.isArray()) {
            records = new ArrayList<>(items.size());
            for (JsonNode item : items) {
                records.add(objectMapper.convertValue(item, MAP_TYPE));
            }
        } else {
            records = Collections.emptyList();
        }
        JsonNode next = response.get("nextPageToken");
        String nextToken = next == null || next.isNull() || next.asText().isEmpty() ? null : next.asText();
        return new CatalogPage(records, nextToken);
    }

    @Override
    public void closeSession(CatalogSession session) {
        if (session == null) {
            return;
        }
        HttpPost post = new HttpPost(endpoint("/auth/logout"));
        authorize(post, session);
        try {
            execute(post, "logout");
            log.debug("CATALOG_SESSION_CLOSED username={}", session.getUsername());
        } catch (RuntimeException e) {
            log.warn("CATALOG_LOGOUT_FAILED username={}, reason={}", session.getUsername(), e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() throws IOException {
        httpClient.close();
    }

    private JsonNode execute(HttpUriRequest request, String operation) {
        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int status = response.getStatusLine().getStatusCode();
            String body = response.getEntity() == null
                    ? ""
                    : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
            if (status == HttpStatus.SC_UNAUTHORIZED || status == HttpStatus.SC_FORBIDDEN) {
                throw new CatalogAuthenticationException(status,
                        "Catalog rejected credentials during " + operation + ", status=" + status);
            }
            if (status < 200 || status >= 300) {
                throw new CatalogTransportException(status,
                        "Catalog " + operation + " failed, status=" + status);
            }
            if (body.isEmpty()) {
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new CatalogTransportException("Catalog " + operation + " IO error: " + e.getMessage(), e);
        }
    }

    private void authorize(HttpUriRequest request, CatalogSession session) {
        request.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + session.getToken());
    }

    private String endpoint(String path) {
        String base = appCatalogProperties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }
}

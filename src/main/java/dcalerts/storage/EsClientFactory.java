package dcalerts.storage;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dcalerts.config.DashboardConfig;
import org.apache.commons.lang3.StringUtils;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.client.CredentialsProvider;
import org.apache.http.conn.ssl.NoopHostnameVerifier;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.apache.http.ssl.SSLContextBuilder;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;

import javax.net.ssl.SSLContext;

/**
 * 根据看板配置创建 ES 客户端
 */
public final class EsClientFactory {

    private EsClientFactory() {
    }

    public static ElasticsearchClient create(DashboardConfig config) {
        return createEsClient(createRestClient(config));
    }

    /**
     * 创建ES REST客户端
     */
    static RestClient createRestClient(DashboardConfig config) {
        String host = config.getString("elasticsearch.host", "localhost");
        int port = config.getInt("elasticsearch.port", 9200);
        String scheme = config.getString("elasticsearch.scheme", "http");
        boolean sslEnabled = config.getBoolean("elasticsearch.ssl", false);
        String userName = config.getString("elasticsearch.username");
        String password = config.getString("elasticsearch.password");
        int timeout = config.getInt("elasticsearch.timeout", 30) * 1000;

        RestClientBuilder builder = RestClient.builder(new HttpHost(host, port, scheme));

        builder.setRequestConfigCallback(requestConfigBuilder ->
                requestConfigBuilder
                        .setConnectTimeout(timeout)
                        .setSocketTimeout(timeout)
                        .setConnectionRequestTimeout(timeout)
        );

        builder.setHttpClientConfigCallback(httpClientBuilder -> {
            if (sslEnabled) {
                try {
                    SSLContext sslContext = SSLContextBuilder.create()
                            .loadTrustMaterial((chain, authType) -> true)
                            .build();
                    httpClientBuilder.setSSLContext(sslContext);
                    httpClientBuilder.setSSLHostnameVerifier(NoopHostnameVerifier.INSTANCE);
                } catch (Exception e) {
                    throw new IllegalStateException("Failed to create SSLContext", e);
                }
            }
            if (StringUtils.isNotEmpty(userName)) {
                CredentialsProvider credentialsProvider = new BasicCredentialsProvider();
                credentialsProvider.setCredentials(
                        AuthScope.ANY,
                        new UsernamePasswordCredentials(userName, StringUtils.defaultString(password))
                );
                httpClientBuilder.setDefaultCredentialsProvider(credentialsProvider);
            }
            return httpClientBuilder;
        });

        return builder.build();
    }

    /**
     * 创建ES高级客户端，时间字段按 ISO 字符串读写
     */
    static ElasticsearchClient createEsClient(RestClient restClient) {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);

        ElasticsearchTransport transport = new RestClientTransport(
                restClient,
                new JacksonJsonpMapper(mapper)
        );

        return new ElasticsearchClient(transport);
    }
}

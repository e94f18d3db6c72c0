package dcalerts.utils;

import okhttp3.Headers;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * 数据源调用用的 HTTP 客户端，状态码交给调用方判断
 */
public class HttpUtils {
    private static final MediaType JSON_TYPE = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient client;

    public HttpUtils(Duration timeout, boolean verifyTls) {
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .writeTimeout(timeout)
                .readTimeout(timeout)
                .callTimeout(timeout);
        if (!verifyTls) {
            X509TrustManager manager = SSLSocketClientUtil.getX509TrustManager();
            builder.sslSocketFactory(SSLSocketClientUtil.getSocketFactory(manager), manager)
                    .hostnameVerifier(SSLSocketClientUtil.getHostnameVerifier());
        }
        this.client = builder.build();
    }

    public HttpResult get(HttpUrl url, Map<String, String> headers) throws IOException {
        Request request = new Request.Builder()
                .url(url)
                .headers(Headers.of(headers))
                .get()
                .build();
        return execute(request);
    }

    public HttpResult post(HttpUrl url, Map<String, String> headers, String jsonBody) throws IOException {
        Request request = new Request.Builder()
                .url(url)
                .headers(Headers.of(headers))
                .post(RequestBody.create(jsonBody, JSON_TYPE))
                .build();
        return execute(request);
    }

    public HttpResult delete(HttpUrl url, Map<String, String> headers) throws IOException {
        Request request = new Request.Builder()
                .url(url)
                .headers(Headers.of(headers))
                .delete()
                .build();
        return execute(request);
    }

    private HttpResult execute(Request request) throws IOException {
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            return new HttpResult(response.code(), body == null ? "" : body.string());
        }
    }

    /**
     * 响应码 + 响应体
     */
    public static class HttpResult {
        private final int code;
        private final String body;

        public HttpResult(int code, String body) {
            this.code = code;
            this.body = body;
        }

        public int getCode() {
            return code;
        }

        public String getBody() {
            return body;
        }

        public boolean isSuccessful() {
            return code >= 200 && code < 300;
        }
    }
}

package com.storyscene.backend.generation.vision;

import com.github.benmanes.caffeine.cache.Cache;
import com.storyscene.backend.generation.config.GenerationProperties;
import com.storyscene.backend.generation.image.ImageSniffer;
import com.storyscene.backend.generation.provider.ImageGenerationCall.ReferenceImage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Downloads character reference images for multimodal models. Misses and failures are skipped:
 * a scene can always be generated without references.
 */
@Slf4j
@Service
public class ReferenceImageLoader {

    public static final int MAX_REFERENCES = 4;
    static final int MAX_BYTES = 8 * 1024 * 1024;

    private final Cache<String, ReferenceImage> cache;
    private final RestClient http;
    private final int maxBytes;

    @Autowired
    public ReferenceImageLoader(@Qualifier("referenceImageCache") Cache<String, ReferenceImage> cache,
                                GenerationProperties props) {
        this(cache, props, MAX_BYTES);
    }

    ReferenceImageLoader(Cache<String, ReferenceImage> cache, GenerationProperties props, int maxBytes) {
        this.cache = cache;
        this.maxBytes = maxBytes;
        SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
        int ms = (int) props.getReferenceFetchTimeout().toMillis();
        f.setConnectTimeout(ms);
        f.setReadTimeout(ms);
        this.http = RestClient.builder().requestFactory(f).build();
    }

    public List<ReferenceImage> load(Collection<String> urls) {
        List<ReferenceImage> out = new ArrayList<>();
        if (urls == null) return out;
        for (String url : urls) {
            if (out.size() >= MAX_REFERENCES) break;
            if (!isHttpUrl(url)) continue;
            ReferenceImage img = cache.getIfPresent(url);
            if (img == null) {
                img = fetch(url);
                if (img != null) cache.put(url, img);
            }
            if (img != null) out.add(img);
        }
        return out;
    }

    private ReferenceImage fetch(String url) {
        try {
            byte[] bytes = http.get().uri(url).exchange((req, res) -> {
                if (!res.getStatusCode().is2xxSuccessful()) {
                    log.warn("reference_image_http_error url={} status={}", url, res.getStatusCode().value());
                    return null;
                }
                long declared = res.getHeaders().getContentLength();
                if (declared > maxBytes) {
                    log.warn("reference_image_too_large url={} contentLength={}", url, declared);
                    return null;
                }
                // bounded read: a missing or lying Content-Length stops at maxBytes + 1
                try (InputStream in = res.getBody()) {
                    byte[] read = in.readNBytes(maxBytes + 1);
                    if (read.length > maxBytes) {
                        log.warn("reference_image_too_large url={} bytes>{}", url, maxBytes);
                        return null;
                    }
                    return read;
                }
            });
            if (bytes == null || bytes.length == 0) {
                if (bytes != null) log.warn("reference_image_skipped url={} bytes=0", url);
                return null;
            }
            ImageSniffer.Detection d = ImageSniffer.detect(bytes);
            if (d == null) {
                log.warn("reference_image_unknown_format url={}", url);
                return null;
            }
            return new ReferenceImage(bytes, d.contentType());
        } catch (RestClientException e) {
            log.warn("reference_image_fetch_failed url={} err={}", url, e.getMessage());
            return null;
        }
    }

    private static boolean isHttpUrl(String url) {
        if (url == null) return false;
        String u = url.trim().toLowerCase(Locale.ROOT);
        return u.startsWith("https://") || u.startsWith("http://");
    }
}

package com.storyscene.backend.generation.provider;

import com.storyscene.backend.generation.model.ImageModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
public class ImageProviderRouter {

    public static final String STUB = "STUB";

    private final Map<String, ImageProviderClient> mapByCode;

    @Autowired
    public ImageProviderRouter(ObjectProvider<ImageProviderClient> clients) {
        this(clients.orderedStream().toList());
    }

    ImageProviderRouter(List<ImageProviderClient> clients) {
        // providerCode -> client; no provider at all is allowed, pick() then fails per call
        Map<String, ImageProviderClient> m = new HashMap<>();
        for (ImageProviderClient c : clients) {
            String code = norm(c.providerCode());
            if (code == null) continue;

            ImageProviderClient prev = m.putIfAbsent(code, c);
            if (prev != null) {
                throw new IllegalStateException(
                        "DUPLICATE_PROVIDER_CODE: " + code
                        + ", prev=" + prev.getClass().getName()
                        + ", dup=" + c.getClass().getName()
                );
            }
        }
        this.mapByCode = Collections.unmodifiableMap(m);

        log.info("ImageProviderRouter initialized. available={}", this.mapByCode.keySet());
    }

    /** Client for the model's provider, else the stub when one is registered. */
    public ImageProviderClient pick(ImageModel model) {
        String code = norm(model == null ? null : model.provider());
        ImageProviderClient c = (code == null) ? null : mapByCode.get(code);
        if (c != null) return c;

        c = mapByCode.get(STUB);
        if (c != null) return c;

        throw new IllegalStateException("PROVIDER_NOT_CONFIGURED");
    }

    public Set<String> available() {
        return mapByCode.keySet();
    }

    private static String norm(String s) {
        if (s == null) return null;
        String v = s.trim().toUpperCase(Locale.ROOT);
        return v.isEmpty() ? null : v;
    }
}

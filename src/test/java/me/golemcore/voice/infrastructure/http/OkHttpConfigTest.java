package me.golemcore.voice.infrastructure.http;

import me.golemcore.voice.infrastructure.config.VoiceProperties;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class OkHttpConfigTest {

    @Test
    void shouldApplyDefaultTimeouts() {
        OkHttpClient client = new OkHttpConfig().okHttpClient(new VoiceProperties());

        assertEquals(10_000, client.connectTimeoutMillis());
        assertEquals(60_000, client.readTimeoutMillis());
        assertEquals(90_000, client.callTimeoutMillis());
    }

    @Test
    void shouldApplyConfiguredTimeouts() {
        VoiceProperties properties = new VoiceProperties();
        properties.getHttp().setConnectTimeout(Duration.ofSeconds(2));
        properties.getHttp().setReadTimeout(Duration.ofSeconds(15));
        properties.getHttp().setCallTimeout(Duration.ofSeconds(30));

        OkHttpClient client = new OkHttpConfig().okHttpClient(properties);

        assertEquals(2_000, client.connectTimeoutMillis());
        assertEquals(15_000, client.readTimeoutMillis());
        assertEquals(30_000, client.callTimeoutMillis());
    }
}

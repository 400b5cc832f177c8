package com.ownding.protect.client;

import com.ownding.protect.common.JsonSupport;
import com.ownding.protect.common.ResourceNotFoundException;
import com.ownding.protect.resource.Camera;
import com.ownding.protect.resource.Liveview;
import com.ownding.protect.resource.ProtectFetchable;
import com.ownding.protect.resource.ResourceKind;
import com.ownding.protect.resource.Viewport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cameras, liveviews and viewports of one Protect controller.
 * <p>
 * Each collection is fetched once and kept for the lifetime of this instance. A failed fetch
 * leaves nothing behind, so the next call asks the controller again. Concurrent first calls
 * for the same kind are not de-duplicated: each hits the controller and the last decoded list
 * to arrive is the one retained.
 */
public class ProtectService {

    private static final Logger log = LoggerFactory.getLogger(ProtectService.class);

    private final ProtectRequestExecutor executor;

    private final AtomicReference<List<Camera>> cachedCameras = new AtomicReference<>();
    private final AtomicReference<List<Liveview>> cachedLiveviews = new AtomicReference<>();
    private final AtomicReference<List<Viewport>> cachedViewports = new AtomicReference<>();

    public ProtectService(ProtectRequestExecutor executor) {
        this.executor = executor;
    }

    public Mono<List<Camera>> cameras() {
        return fetchAndCache(ResourceKind.CAMERA, cachedCameras);
    }

    public Mono<List<Liveview>> liveviews() {
        return fetchAndCache(ResourceKind.LIVEVIEW, cachedLiveviews);
    }

    public Mono<List<Viewport>> viewports() {
        return fetchAndCache(ResourceKind.VIEWPORT, cachedViewports);
    }

    /**
     * Live JPEG snapshot of the camera with the given name, never cached.
     * {@code highQuality} is accepted but not yet forwarded to the controller.
     */
    public Mono<byte[]> snapshot(String cameraName, boolean highQuality) {
        log.debug("Getting snapshot for camera '{}' (highQuality={})", cameraName, highQuality);
        return lookupCameraId(cameraName)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Camera", cameraName)))
                .flatMap(cameraId -> executor.execute(
                        ProtectRequest.get(Camera.URL_SUFFIX + "/" + cameraId + "/snapshot")
                                .accepting(MediaType.IMAGE_JPEG)));
    }

    /**
     * Points a viewport at another liveview. Neither id is checked before the PATCH is sent.
     */
    public Mono<Void> changeViewportView(String viewportId, String liveviewId) {
        return Mono.fromCallable(() -> JsonSupport.toJsonBytes(Map.of("liveview", liveviewId)))
                .flatMap(body -> executor.execute(ProtectRequest.get(Viewport.URL_SUFFIX + "/" + viewportId)
                        .withMethod(HttpMethod.PATCH)
                        .withBody(body)))
                .doOnNext(ignored -> log.info("Viewport {} switched to liveview {}", viewportId, liveviewId))
                .then();
    }

    public Mono<String> lookupCameraId(String name) {
        log.debug("Getting camera id for '{}'", name);
        return findIdByName(cameras(), name);
    }

    public Mono<String> lookupViewportId(String name) {
        log.debug("Getting viewport id for '{}'", name);
        return findIdByName(viewports(), name);
    }

    public Mono<String> lookupLiveviewId(String name) {
        log.debug("Getting liveview id for '{}'", name);
        return findIdByName(liveviews(), name);
    }

    public Mono<String> lookupLiveviewName(String id) {
        log.debug("Getting liveview name for {}", id);
        return liveviews().flatMap(items -> Mono.justOrEmpty(items.stream()
                .filter(liveview -> liveview.id().equals(id))
                .map(Liveview::name)
                .findFirst()));
    }

    private <T extends ProtectFetchable> Mono<List<T>> fetchAndCache(ResourceKind<T> kind,
                                                                      AtomicReference<List<T>> cache) {
        return Mono.defer(() -> {
            List<T> cached = cache.get();
            if (cached != null) {
                log.debug("Returning cached result for {}", kind.urlSuffix());
                return Mono.just(cached);
            }
            log.debug("Loading {} data from server", kind.urlSuffix());
            return executor.execute(ProtectRequest.get(kind.urlSuffix()))
                    .map(kind::decode)
                    .doOnNext(cache::set);
        });
    }

    // first match in controller order wins
    private static <T extends ProtectFetchable> Mono<String> findIdByName(Mono<List<T>> source, String name) {
        return Mono.defer(() -> {
            String wanted = Objects.requireNonNull(name, "name").toLowerCase(Locale.ROOT);
            return source.flatMap(items -> Mono.justOrEmpty(items.stream()
                    .filter(item -> item.name().toLowerCase(Locale.ROOT).equals(wanted))
                    .map(ProtectFetchable::id)
                    .findFirst()));
        });
    }
}

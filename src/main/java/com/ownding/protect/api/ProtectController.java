package com.ownding.protect.api;

import com.ownding.protect.client.ProtectService;
import com.ownding.protect.common.ApiException;
import com.ownding.protect.common.ApiResult;
import com.ownding.protect.common.ResourceNotFoundException;
import com.ownding.protect.resource.Camera;
import com.ownding.protect.resource.Liveview;
import com.ownding.protect.resource.ProtectFetchable;
import com.ownding.protect.resource.ResourceKind;
import com.ownding.protect.resource.Viewport;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@Validated
@RestController
@RequestMapping("/api/protect")
public class ProtectController {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final ProtectService protectService;

    public ProtectController(ProtectService protectService) {
        this.protectService = protectService;
    }

    @GetMapping("/cameras")
    public Mono<ApiResult<List<Camera>>> cameras(@RequestParam(defaultValue = "false") boolean sorted) {
        return protectService.cameras().map(items -> ApiResult.success(ordered(items, sorted)));
    }

    @GetMapping("/liveviews")
    public Mono<ApiResult<List<Liveview>>> liveviews(@RequestParam(defaultValue = "false") boolean sorted) {
        return protectService.liveviews().map(items -> ApiResult.success(ordered(items, sorted)));
    }

    @GetMapping("/viewports")
    public Mono<ApiResult<List<Viewport>>> viewports(@RequestParam(defaultValue = "false") boolean sorted) {
        return protectService.viewports().map(items -> ApiResult.success(ordered(items, sorted)));
    }

    @GetMapping("/cameras/csv")
    public Mono<ResponseEntity<String>> camerasCsv() {
        return protectService.cameras().map(items -> csv(ResourceKind.CAMERA.toCsv(items)));
    }

    @GetMapping("/liveviews/csv")
    public Mono<ResponseEntity<String>> liveviewsCsv() {
        return protectService.liveviews().map(items -> csv(ResourceKind.LIVEVIEW.toCsv(items)));
    }

    @GetMapping("/viewports/csv")
    public Mono<ResponseEntity<String>> viewportsCsv() {
        return protectService.viewports().map(items -> csv(ResourceKind.VIEWPORT.toCsv(items)));
    }

    @GetMapping("/cameras/{name}/snapshot")
    public Mono<ResponseEntity<byte[]>> snapshot(@PathVariable String name,
                                                 @RequestParam(defaultValue = "false") boolean highQuality) {
        return protectService.snapshot(name, highQuality)
                .map(image -> ResponseEntity.ok().contentType(MediaType.IMAGE_JPEG).body(image));
    }

    @GetMapping("/cameras/lookup")
    public Mono<ApiResult<String>> lookupCamera(@RequestParam @NotBlank String name) {
        return protectService.lookupCameraId(name)
                .map(ApiResult::success)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Camera", name)));
    }

    @GetMapping("/viewports/lookup")
    public Mono<ApiResult<String>> lookupViewport(@RequestParam @NotBlank String name) {
        return protectService.lookupViewportId(name)
                .map(ApiResult::success)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Viewport", name)));
    }

    @GetMapping("/liveviews/{id}/name")
    public Mono<ApiResult<String>> liveviewName(@PathVariable String id) {
        return protectService.lookupLiveviewName(id)
                .map(ApiResult::success)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Liveview", id)));
    }

    @PatchMapping("/viewports/{viewportId}/liveview")
    public Mono<ApiResult<Void>> switchLiveview(@PathVariable String viewportId,
                                                @Valid @RequestBody SwitchLiveviewRequest request) {
        return resolveLiveviewId(request)
                .flatMap(liveviewId -> protectService.changeViewportView(viewportId, liveviewId)
                        .thenReturn(ApiResult.successMessage("Viewport switched to liveview " + liveviewId)));
    }

    private Mono<String> resolveLiveviewId(SwitchLiveviewRequest request) {
        if (request.liveviewId() != null && !request.liveviewId().isBlank()) {
            return Mono.just(request.liveviewId());
        }
        if (request.liveviewName() != null && !request.liveviewName().isBlank()) {
            return protectService.lookupLiveviewId(request.liveviewName())
                    .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Liveview", request.liveviewName())));
        }
        return Mono.error(new ApiException(HttpStatus.BAD_REQUEST, "liveviewId or liveviewName is required"));
    }

    private static <T extends ProtectFetchable> List<T> ordered(List<T> items, boolean sorted) {
        if (!sorted) {
            return items;
        }
        return items.stream().sorted(ProtectFetchable.<T>byName()).toList();
    }

    private static ResponseEntity<String> csv(String body) {
        return ResponseEntity.ok().contentType(TEXT_CSV).body(body);
    }

    public record SwitchLiveviewRequest(String liveviewId, String liveviewName) {
    }
}

package at.sv.huepanel.api.hue;

import at.sv.huepanel.api.ApiFailure;
import at.sv.huepanel.api.HttpResourceProvider;
import at.sv.huepanel.api.ResourceNotFoundException;
import at.sv.huepanel.api.SnapshotSource;
import at.sv.huepanel.snapshot.LightSnapshot;
import at.sv.huepanel.snapshot.MotionZoneSnapshot;
import at.sv.huepanel.snapshot.RoomSnapshot;
import at.sv.huepanel.snapshot.Snapshot;
import at.sv.huepanel.snapshot.ZoneSnapshot;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reads the state of a Hue bridge via the CLIP v2 API. Rooms, zones, devices, behaviors and connectivity rarely
 * change and are cached per bridge address; lights and motion areas are requested on every call.
 */
@Slf4j
public final class HueSnapshotSource implements SnapshotSource {

    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);

    private final HttpResourceProvider resourceProvider;
    private final ObjectMapper mapper;
    private final Cache<String, Map<String, Group>> roomsCache;
    private final Cache<String, Map<String, Group>> zonesCache;
    private final Cache<String, Map<String, Device>> devicesCache;
    private final Cache<String, Map<String, ZigbeeConnectivity>> zigbeeConnectivityCache;
    private final Cache<String, Map<String, BehaviorInstance>> behaviorsCache;

    public HueSnapshotSource(HttpResourceProvider resourceProvider) {
        this(resourceProvider, DEFAULT_CACHE_TTL, Ticker.systemTicker());
    }

    public HueSnapshotSource(HttpResourceProvider resourceProvider, Duration cacheTtl, Ticker ticker) {
        this.resourceProvider = resourceProvider;
        mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        roomsCache = createCache(cacheTtl, ticker);
        zonesCache = createCache(cacheTtl, ticker);
        devicesCache = createCache(cacheTtl, ticker);
        zigbeeConnectivityCache = createCache(cacheTtl, ticker);
        behaviorsCache = createCache(cacheTtl, ticker);
    }

    private static <T> Cache<String, Map<String, T>> createCache(Duration cacheTtl, Ticker ticker) {
        return Caffeine.newBuilder()
                       .expireAfterWrite(cacheTtl)
                       .ticker(ticker)
                       .build();
    }

    private static void assertNotHttpSchemeProvided(String host) {
        if (host == null || host.isBlank()) {
            throw new InvalidConnectionException("No Hue Bridge host provided");
        }
        if (host.toLowerCase(Locale.ROOT).startsWith("http")) {
            throw new InvalidConnectionException("Invalid host provided. Hue Bridge host can't contain a scheme: " + host);
        }
    }

    @Override
    public Snapshot getSnapshot(String bridgeAddress, String credential) {
        assertNotHttpSchemeProvided(bridgeAddress);
        Map<String, Light> lights = lookup(bridgeAddress, credential, "/light", new TypeReference<LightResponse>() {
        }, Light::getId);
        Map<String, ConvenienceAreaMotion> motionAreas = lookupIfSupported(bridgeAddress, credential,
                "/convenience_area_motion", new TypeReference<ConvenienceAreaMotionResponse>() {
                }, ConvenienceAreaMotion::getId);
        Map<String, Group> rooms = roomsCache.get(bridgeAddress, key -> lookup(key, credential, "/room",
                new TypeReference<GroupResponse>() {
                }, Group::getId));
        Map<String, Group> zones = zonesCache.get(bridgeAddress, key -> lookupIfSupported(key, credential, "/zone",
                new TypeReference<GroupResponse>() {
                }, Group::getId));
        Map<String, Device> devices = devicesCache.get(bridgeAddress, key -> lookup(key, credential, "/device",
                new TypeReference<DeviceResponse>() {
                }, Device::getId));
        Map<String, ZigbeeConnectivity> connectivity = zigbeeConnectivityCache.get(bridgeAddress,
                key -> lookup(key, credential, "/zigbee_connectivity", new TypeReference<ZigbeeConnectivityResponse>() {
                }, ZigbeeConnectivity::getId));
        Map<String, BehaviorInstance> behaviors = behaviorsCache.get(bridgeAddress,
                key -> lookupIfSupported(key, credential, "/behavior_instance", new TypeReference<BehaviorInstanceResponse>() {
                }, BehaviorInstance::getId));

        List<RoomSnapshot> roomSnapshots = createRoomSnapshots(rooms, lights);
        List<ZoneSnapshot> zoneSnapshots = createZoneSnapshots(zones, lights);
        List<LightSnapshot> lightSnapshots = createLightSnapshots(lights, rooms, devices, connectivity);
        List<MotionZoneSnapshot> motionZones = createMotionZones(behaviors, motionAreas);
        log.trace("Fetched {} lights, {} rooms, {} zones, {} motion zones from {}", lightSnapshots.size(),
                roomSnapshots.size(), zoneSnapshots.size(), motionZones.size(), bridgeAddress);
        return Snapshot.of(lightSnapshots, roomSnapshots, zoneSnapshots, motionZones);
    }

    /**
     * Drops all cached resources of the given bridge, e.g. after re-pairing.
     */
    public void clearCache(String bridgeAddress) {
        roomsCache.invalidate(bridgeAddress);
        zonesCache.invalidate(bridgeAddress);
        devicesCache.invalidate(bridgeAddress);
        zigbeeConnectivityCache.invalidate(bridgeAddress);
        behaviorsCache.invalidate(bridgeAddress);
        log.debug("Cleared cache for bridge {}", bridgeAddress);
    }

    private List<LightSnapshot> createLightSnapshots(Map<String, Light> lights, Map<String, Group> rooms,
                                                     Map<String, Device> devices,
                                                     Map<String, ZigbeeConnectivity> connectivity) {
        return lights.values()
                     .stream()
                     .map(light -> light.toSnapshot(findRoomId(light, rooms), isReachable(light, devices, connectivity)))
                     .sorted(Comparator.comparing(LightSnapshot::name, Comparator.nullsLast(Comparator.naturalOrder()))
                                       .thenComparing(LightSnapshot::id))
                     .toList();
    }

    private static String findRoomId(Light light, Map<String, Group> rooms) {
        return rooms.values()
                    .stream()
                    .filter(room -> containsLight(room, light))
                    .map(Group::getId)
                    .findFirst()
                    .orElse(null);
    }

    private static boolean containsLight(Group room, Light light) {
        String ownerId = light.getOwnerId();
        return room.containsLight(light.getId()) || ownerId != null && room.containsDevice(ownerId);
    }

    private static boolean isReachable(Light light, Map<String, Device> devices,
                                       Map<String, ZigbeeConnectivity> connectivity) {
        String ownerId = light.getOwnerId();
        if (ownerId == null) {
            return true;
        }
        Device device = devices.get(ownerId);
        if (device == null) {
            return true;
        }
        return device.getZigbeeConnectivityResource()
                     .map(connectivity::get)
                     .map(zigbee -> !zigbee.isUnavailable())
                     .orElse(true);
    }

    private static List<RoomSnapshot> createRoomSnapshots(Map<String, Group> rooms, Map<String, Light> lights) {
        return rooms.values()
                    .stream()
                    .map(room -> new RoomSnapshot(room.getId(), room.getName(), getLightIds(room, lights)))
                    .sorted(Comparator.comparing(RoomSnapshot::name, Comparator.nullsLast(Comparator.naturalOrder()))
                                      .thenComparing(RoomSnapshot::id))
                    .toList();
    }

    /**
     * Zones without any existing light are skipped.
     */
    private static List<ZoneSnapshot> createZoneSnapshots(Map<String, Group> zones, Map<String, Light> lights) {
        return zones.values()
                    .stream()
                    .map(zone -> new ZoneSnapshot(zone.getId(), Objects.requireNonNullElse(zone.getName(), "Unknown Zone"),
                            getLightIds(zone, lights)))
                    .filter(zone -> !zone.lightIds().isEmpty())
                    .sorted(Comparator.comparing(ZoneSnapshot::name).thenComparing(ZoneSnapshot::id))
                    .toList();
    }

    private static List<String> getLightIds(Group room, Map<String, Light> lights) {
        return lights.values()
                     .stream()
                     .filter(light -> containsLight(room, light))
                     .map(Light::getId)
                     .sorted()
                     .toList();
    }

    private static List<MotionZoneSnapshot> createMotionZones(Map<String, BehaviorInstance> behaviors,
                                                              Map<String, ConvenienceAreaMotion> motionAreas) {
        return behaviors.values()
                        .stream()
                        .filter(behavior -> behavior.getConvenienceAreaMotionId().isPresent())
                        .map(behavior -> createMotionZone(behavior, motionAreas.get(behavior.getConvenienceAreaMotionId().get())))
                        .sorted(Comparator.comparing(MotionZoneSnapshot::name).thenComparing(MotionZoneSnapshot::id))
                        .toList();
    }

    private static MotionZoneSnapshot createMotionZone(BehaviorInstance behavior, ConvenienceAreaMotion area) {
        String name = Objects.requireNonNullElse(behavior.getName(), "Unknown Zone");
        if (area == null) {
            return new MotionZoneSnapshot(behavior.getId(), name, false, behavior.isEnabled(), true, null);
        }
        return MotionZoneSnapshot.builder()
                                 .id(behavior.getId())
                                 .name(name)
                                 .motionDetected(area.isMotionDetected())
                                 .enabled(behavior.isEnabled() && area.isEnabled())
                                 .reachable(area.isMotionValid())
                                 .lastChanged(area.getLastChanged())
                                 .build();
    }

    private URL createUrl(String bridgeAddress, String endpoint) {
        try {
            return new URI("https://" + bridgeAddress + "/clip/v2/resource" + endpoint).toURL();
        } catch (MalformedURLException | URISyntaxException | IllegalArgumentException e) {
            throw new InvalidConnectionException("Failed to construct API url for host '" + bridgeAddress + "': " + e.getMessage());
        }
    }

    private <T, C extends DataListContainer<T>> Map<String, T> lookup(String bridgeAddress, String credential,
                                                                      String endpoint, TypeReference<C> typeReference,
                                                                      Function<T, String> idFunction) {
        String response = resourceProvider.getResource(createUrl(bridgeAddress, endpoint), credential);
        C container = parse(response, typeReference);
        if (container.getErrors() != null && !container.getErrors().isEmpty()) {
            throw new ApiFailure("Bridge returned errors for '" + endpoint + "': " + container.getErrors());
        }
        if (container.getData() == null) {
            throw new ApiFailure("Missing data in response for '" + endpoint + "': " + response);
        }
        return container.getData()
                        .stream()
                        .collect(Collectors.toMap(idFunction, Function.identity(), (first, second) -> first));
    }

    /**
     * Older bridges don't know the MotionAware resources and answer with 404.
     */
    private <T, C extends DataListContainer<T>> Map<String, T> lookupIfSupported(String bridgeAddress, String credential,
                                                                                 String endpoint,
                                                                                 TypeReference<C> typeReference,
                                                                                 Function<T, String> idFunction) {
        try {
            return lookup(bridgeAddress, credential, endpoint, typeReference, idFunction);
        } catch (ResourceNotFoundException e) {
            log.debug("Bridge {} does not support '{}'", bridgeAddress, endpoint);
            return Map.of();
        }
    }

    private <C> C parse(String response, TypeReference<C> typeReference) {
        try {
            C container = mapper.readValue(response, typeReference);
            if (container == null) {
                throw new ApiFailure("Empty response");
            }
            return container;
        } catch (ApiFailure e) {
            throw e;
        } catch (Exception e) {
            throw new ApiFailure("Failed to parse response '" + response + "': " + e.getLocalizedMessage(), e);
        }
    }

    private interface DataListContainer<T> {
        List<T> getData();

        List<Map<String, Object>> getErrors();
    }

    @Data
    private static final class LightResponse implements DataListContainer<Light> {
        List<Light> data;
        List<Map<String, Object>> errors;
    }

    @Data
    private static final class GroupResponse implements DataListContainer<Group> {
        List<Group> data;
        List<Map<String, Object>> errors;
    }

    @Data
    private static final class DeviceResponse implements DataListContainer<Device> {
        List<Device> data;
        List<Map<String, Object>> errors;
    }

    @Data
    private static final class ZigbeeConnectivityResponse implements DataListContainer<ZigbeeConnectivity> {
        List<ZigbeeConnectivity> data;
        List<Map<String, Object>> errors;
    }

    @Data
    private static final class BehaviorInstanceResponse implements DataListContainer<BehaviorInstance> {
        List<BehaviorInstance> data;
        List<Map<String, Object>> errors;
    }

    @Data
    private static final class ConvenienceAreaMotionResponse implements DataListContainer<ConvenienceAreaMotion> {
        List<ConvenienceAreaMotion> data;
        List<Map<String, Object>> errors;
    }
}

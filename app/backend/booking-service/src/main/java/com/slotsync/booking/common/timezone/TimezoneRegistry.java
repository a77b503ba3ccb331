package com.slotsync.booking.common.timezone;

import com.slotsync.booking.common.exception.TimezoneDataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.zone.ZoneRulesException;
import java.time.zone.ZoneRulesProvider;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;

/**
 * 타임존 레지스트리
 *
 * 기동 시 JDK tzdb를 한 번 읽어 불변 맵으로 보관한다. DST 계산은 전적으로 tzdb 규칙에 맡긴다.
 * 로드에 실패하면 TimezoneDataException으로 애플리케이션 기동을 중단한다.
 */
@Component
@Slf4j
public class TimezoneRegistry {

    private static final String VERSION_PROBE_ZONE = "Europe/London";

    private final Map<String, ZoneId> zones;
    private final String dataVersion;

    public TimezoneRegistry() {
        Set<String> zoneIds = ZoneId.getAvailableZoneIds();
        if (zoneIds.isEmpty()) {
            throw new TimezoneDataException("타임존 데이터베이스가 비어 있습니다.");
        }

        Map<String, ZoneId> loaded = new HashMap<>();
        for (String zoneId : zoneIds) {
            try {
                ZoneId zone = ZoneId.of(zoneId);
                zone.getRules();
                loaded.put(zoneId, zone);
            } catch (DateTimeException e) {
                throw new TimezoneDataException("타임존 규칙을 불러올 수 없습니다: " + zoneId, e);
            }
        }

        this.zones = Map.copyOf(loaded);
        this.dataVersion = probeVersion();
        log.info("타임존 데이터 로드 완료 - zones: {}, tzdb version: {}", zones.size(), dataVersion);
    }

    /**
     * 타임존 ID 조회
     *
     * @param zoneId IANA 타임존 ID (예: "Asia/Seoul")
     * @return 등록되지 않은 ID면 Optional.empty()
     */
    public Optional<ZoneId> find(String zoneId) {
        if (zoneId == null || zoneId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(zones.get(zoneId));
    }

    public boolean isSupported(String zoneId) {
        return find(zoneId).isPresent();
    }

    public int size() {
        return zones.size();
    }

    public String getDataVersion() {
        return dataVersion;
    }

    private static String probeVersion() {
        try {
            NavigableMap<String, ?> versions = ZoneRulesProvider.getVersions(VERSION_PROBE_ZONE);
            return versions.isEmpty() ? "unknown" : versions.lastKey();
        } catch (ZoneRulesException e) {
            log.warn("tzdb 버전 확인 실패: {}", e.getMessage());
            return "unknown";
        }
    }
}

package com.ryuqq.swarm.adapter.launcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 운영체제 메모리 정보.
 *
 * <p>Linux에서는 {@code /proc/meminfo}의 MemAvailable(페이지 캐시 회수분 포함)을 사용하고,
 * 없으면 {@code com.sun.management.OperatingSystemMXBean}의 free memory를 사용합니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class JvmSystemResources implements SystemResources {

    private static final Logger log = LoggerFactory.getLogger(JvmSystemResources.class);
    private static final Path MEMINFO = Path.of("/proc/meminfo");
    private static final long MB = 1024L * 1024L;

    @Override
    public long availableMemoryMb() {
        if (Files.isReadable(MEMINFO)) {
            try {
                List<String> lines = Files.readAllLines(MEMINFO);
                for (String line : lines) {
                    if (line.startsWith("MemAvailable:")) {
                        return parseKilobytes(line) / 1024;
                    }
                }
            } catch (IOException | NumberFormatException e) {
                log.debug("Could not read {}: {}", MEMINFO, e.getMessage());
            }
        }
        OperatingSystemMXBean bean = ManagementFactory.getOperatingSystemMXBean();
        if (bean instanceof com.sun.management.OperatingSystemMXBean osBean) {
            return osBean.getFreeMemorySize() / MB;
        }
        return Runtime.getRuntime().maxMemory() / MB;
    }

    static long parseKilobytes(String line) {
        String[] parts = line.trim().split("\\s+");
        return Long.parseLong(parts[1]);
    }
}

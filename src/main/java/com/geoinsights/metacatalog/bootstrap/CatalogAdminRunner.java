package com.geoinsights.metacatalog.bootstrap;

import com.geoinsights.metacatalog.application.admin.CatalogMaintenanceService;
import com.geoinsights.metacatalog.application.admin.RequestPostService;
import com.geoinsights.metacatalog.application.admin.SystemProfileService;
import com.geoinsights.metacatalog.application.admin.XmlValidationService;
import com.geoinsights.metacatalog.application.common.error.CatalogAdminException;
import com.geoinsights.metacatalog.application.common.error.ErrorCodes;
import com.geoinsights.metacatalog.application.export.RecordExportService;
import com.geoinsights.metacatalog.application.export.SitemapService;
import com.geoinsights.metacatalog.application.harvest.HarvestReport;
import com.geoinsights.metacatalog.application.harvest.HarvestRefreshService;
import com.geoinsights.metacatalog.application.sync.RecordSyncService;
import com.geoinsights.metacatalog.application.sync.SyncReport;
import com.geoinsights.metacatalog.config.CatalogProperties;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 카탈로그 관리 명령을 실행하는 {@link ApplicationRunner}.
 *
 * <p>Profile이 {@code admin}일 때만 활성화된다.</p>
 * <p>사용법: {@code --spring.profiles.active=admin <command> [--option=value ...]}</p>
 *
 * <p>명령 오류는 {@link CatalogAdminException}으로 던져져 애플리케이션 시작 실패(0이 아닌 종료 코드)로 끝난다.</p>
 */
@Component
@Profile("admin")
@Order(1)
public class CatalogAdminRunner implements ApplicationRunner {

    /** 로그 레벨을 조정할 애플리케이션 로거 */
    static final String APP_LOGGER = "com.geoinsights.metacatalog";

    static final String USAGE = """
            Usage: <command> [--option=value ...]
              setup-db
              load-records --path=<file|dir> [--recursive] [--yes]
              delete-records --yes
              export-records --path=<dir>
              rebuild-db-indexes
              optimize-db
              refresh-harvested-records [--url=<csw endpoint>]
              gen-sitemap --output=<file>
              post-xml --url=<endpoint> --xml=<file> [--timeout=<seconds>]
              validate-xml --xml=<file> --xsd=<file>
              get-sysprof
            Global: --verbosity=ERROR|WARNING|INFO|DEBUG""";

    private static final Map<String, LogLevel> VERBOSITY = Map.of(
            "ERROR", LogLevel.ERROR,
            "WARNING", LogLevel.WARN,
            "INFO", LogLevel.INFO,
            "DEBUG", LogLevel.DEBUG
    );

    private static final int DEFAULT_POST_TIMEOUT_SECONDS = 30;

    private final SchemaProvisioner provisioner;
    private final RecordSyncService syncService;
    private final CatalogMaintenanceService maintenanceService;
    private final RecordExportService exportService;
    private final HarvestRefreshService harvestService;
    private final SitemapService sitemapService;
    private final RequestPostService postService;
    private final XmlValidationService validationService;
    private final SystemProfileService profileService;
    private final CatalogProperties props;
    private final LoggingSystem loggingSystem;

    public CatalogAdminRunner(
            SchemaProvisioner provisioner,
            RecordSyncService syncService,
            CatalogMaintenanceService maintenanceService,
            RecordExportService exportService,
            HarvestRefreshService harvestService,
            SitemapService sitemapService,
            RequestPostService postService,
            XmlValidationService validationService,
            SystemProfileService profileService,
            CatalogProperties props,
            LoggingSystem loggingSystem
    ) {
        this.provisioner = provisioner;
        this.syncService = syncService;
        this.maintenanceService = maintenanceService;
        this.exportService = exportService;
        this.harvestService = harvestService;
        this.sitemapService = sitemapService;
        this.postService = postService;
        this.validationService = validationService;
        this.profileService = profileService;
        this.props = props;
        this.loggingSystem = loggingSystem;
    }

    /**
     * 첫 번째 non-option 인자를 명령으로 해석해 실행합니다.
     * 각 명령은 결과가 나올 때까지 {@code block()}으로 대기합니다.
     *
     * @param args 커맨드라인 인자
     */
    @Override
    public void run(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.isEmpty()) {
            throw new CatalogAdminException("ERROR: No command given\n" + USAGE, ErrorCodes.INVALID_COMMAND);
        }
        applyVerbosity(args);

        String command = commands.get(0);
        switch (command) {
            case "setup-db" -> {
                int applied = provisioner.provision();
                System.out.println("Database setup done. migrations=" + applied);
            }
            case "load-records" -> {
                SyncReport report = syncService.load(
                        Path.of(required(args, "path")),
                        args.containsOption("recursive"),
                        args.containsOption("yes")
                ).block();
                System.out.println("Files processed: " + (report == null ? 0 : report.processedFiles().size()));
            }
            case "delete-records" -> {
                if (!args.containsOption("yes")) {
                    throw new CatalogAdminException(
                            "ERROR: Deleting all records requires --yes", ErrorCodes.CONFIRMATION_REQUIRED);
                }
                Long deleted = maintenanceService.deleteAll().block();
                System.out.println("Deleted records: " + deleted);
            }
            case "export-records" -> {
                Set<Path> written = exportService.export(Path.of(required(args, "path"))).block();
                System.out.println("Exported files: " + (written == null ? 0 : written.size()));
            }
            case "rebuild-db-indexes" -> {
                maintenanceService.rebuildIndexes().block();
                System.out.println("Indexes rebuilt");
            }
            case "optimize-db" -> {
                maintenanceService.optimize().block();
                System.out.println("Database optimized");
            }
            case "refresh-harvested-records" -> {
                String url = optional(args, "url", props.server().url());
                HarvestReport report = harvestService.refreshHarvested(url).block();
                System.out.println("Harvest refresh: " + report);
            }
            case "gen-sitemap" -> {
                Long entries = sitemapService.generate(props.server().url(), Path.of(required(args, "output"))).block();
                System.out.println("Sitemap entries: " + entries);
            }
            case "post-xml" -> {
                String response = postService.post(
                        required(args, "url"),
                        Path.of(required(args, "xml")),
                        Duration.ofSeconds(seconds(optional(args, "timeout", String.valueOf(DEFAULT_POST_TIMEOUT_SECONDS))))
                ).block();
                System.out.println(response);
            }
            case "validate-xml" -> {
                validationService.validate(Path.of(required(args, "xml")), Path.of(required(args, "xsd")));
                System.out.println("Valid");
            }
            case "get-sysprof" -> System.out.println(profileService.profile().block());
            default -> throw new CatalogAdminException(
                    "ERROR: Unknown command: " + command + "\n" + USAGE, ErrorCodes.INVALID_COMMAND);
        }
    }

    /**
     * {@code --verbosity}가 있으면 애플리케이션 로거 레벨을 바꿉니다.
     */
    private void applyVerbosity(ApplicationArguments args) {
        if (!args.containsOption("verbosity")) {
            return;
        }
        String value = required(args, "verbosity").toUpperCase();
        LogLevel level = VERBOSITY.get(value);
        if (level == null) {
            throw new CatalogAdminException("ERROR: Invalid verbosity: " + value, ErrorCodes.INVALID_COMMAND);
        }
        loggingSystem.setLogLevel(APP_LOGGER, level);
    }

    private static String required(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            throw new CatalogAdminException("ERROR: Missing required option --" + name, ErrorCodes.INVALID_COMMAND);
        }
        return values.get(0);
    }

    private static String optional(ApplicationArguments args, String name, String defaultValue) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() || values.get(0).isBlank() ? defaultValue : values.get(0);
    }

    private static long seconds(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new CatalogAdminException("ERROR: Invalid --timeout: " + value, ErrorCodes.INVALID_COMMAND, e);
        }
    }
}

package io.mersel.services.addenda.infrastructure.config;

import io.mersel.services.addenda.application.enums.ResolutionMode;
import io.mersel.services.addenda.application.models.CfdiNamespaces;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Configuración del servicio de addendas.
 * <p>
 * Lee los valores bajo el prefijo {@code addenda}:
 * <ul>
 *   <li>{@code limits.max-document-size-mb}: tamaño máximo de CFDI, plantilla o XML a validar (por defecto 5)</li>
 *   <li>{@code resolution.mode}: {@code LENIENT} (vacío ante variables faltantes) o {@code STRICT}</li>
 *   <li>{@code cfdi.namespace-uri}, {@code cfdi.tfd-namespace-uri}, {@code cfdi.required-version-prefix}</li>
 *   <li>{@code cache.schema-max-size}, {@code cache.schema-ttl-hours}: caché de esquemas XSD compilados</li>
 *   <li>{@code system.zone-id}: zona horaria de las variables {@code current_*}</li>
 * </ul>
 * Los valores inválidos se reemplazan por el valor por defecto con una advertencia en el log.
 */
@ConfigurationProperties(prefix = "addenda")
public class AddendaProperties {

    private static final Logger log = LoggerFactory.getLogger(AddendaProperties.class);

    static final int DEFAULT_MAX_DOCUMENT_SIZE_MB = 5;
    static final int DEFAULT_SCHEMA_CACHE_MAX_SIZE = 50;
    static final int DEFAULT_SCHEMA_CACHE_TTL_HOURS = 1;
    static final String DEFAULT_ZONE_ID = "America/Mexico_City";

    private final Limits limits = new Limits();
    private final Resolution resolution = new Resolution();
    private final Cfdi cfdi = new Cfdi();
    private final Cache cache = new Cache();
    private final SystemVariables system = new SystemVariables();

    @PostConstruct
    void validate() {
        if (limits.maxDocumentSizeMb <= 0) {
            log.warn("max-document-size-mb debe ser positivo (recibido: {}), se usa el valor por defecto {} MB",
                    limits.maxDocumentSizeMb, DEFAULT_MAX_DOCUMENT_SIZE_MB);
            limits.maxDocumentSizeMb = DEFAULT_MAX_DOCUMENT_SIZE_MB;
        }
        if (resolution.mode == null) {
            log.warn("resolution.mode no definido, se usa LENIENT");
            resolution.mode = ResolutionMode.LENIENT;
        }
        if (cache.schemaMaxSize <= 0) {
            log.warn("schema-max-size debe ser positivo (recibido: {}), se usa {}",
                    cache.schemaMaxSize, DEFAULT_SCHEMA_CACHE_MAX_SIZE);
            cache.schemaMaxSize = DEFAULT_SCHEMA_CACHE_MAX_SIZE;
        }
        if (cache.schemaTtlHours <= 0) {
            log.warn("schema-ttl-hours debe ser positivo (recibido: {}), se usa {}",
                    cache.schemaTtlHours, DEFAULT_SCHEMA_CACHE_TTL_HOURS);
            cache.schemaTtlHours = DEFAULT_SCHEMA_CACHE_TTL_HOURS;
        }
        try {
            ZoneId.of(system.zoneId);
        } catch (DateTimeException | NullPointerException e) {
            log.warn("zone-id inválido ({}), se usa {}", system.zoneId, DEFAULT_ZONE_ID);
            system.zoneId = DEFAULT_ZONE_ID;
        }
        if (isBlank(cfdi.namespaceUri)) {
            cfdi.namespaceUri = CfdiNamespaces.CFDI_40.cfdiUri();
        }
        if (isBlank(cfdi.tfdNamespaceUri)) {
            cfdi.tfdNamespaceUri = CfdiNamespaces.CFDI_40.tfdUri();
        }
    }

    /** Tamaño máximo en bytes. */
    public long maxDocumentBytes() {
        return (long) limits.maxDocumentSizeMb * 1024 * 1024;
    }

    public CfdiNamespaces toCfdiNamespaces() {
        return new CfdiNamespaces(cfdi.namespaceUri, cfdi.tfdNamespaceUri, cfdi.requiredVersionPrefix);
    }

    public ZoneId zoneId() {
        return ZoneId.of(system.zoneId);
    }

    public Limits getLimits() {
        return limits;
    }

    public Resolution getResolution() {
        return resolution;
    }

    public Cfdi getCfdi() {
        return cfdi;
    }

    public Cache getCache() {
        return cache;
    }

    public SystemVariables getSystem() {
        return system;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public static class Limits {
        private int maxDocumentSizeMb = DEFAULT_MAX_DOCUMENT_SIZE_MB;

        public int getMaxDocumentSizeMb() {
            return maxDocumentSizeMb;
        }

        public void setMaxDocumentSizeMb(int maxDocumentSizeMb) {
            this.maxDocumentSizeMb = maxDocumentSizeMb;
        }
    }

    public static class Resolution {
        private ResolutionMode mode = ResolutionMode.LENIENT;

        public ResolutionMode getMode() {
            return mode;
        }

        public void setMode(ResolutionMode mode) {
            this.mode = mode;
        }
    }

    public static class Cfdi {
        private String namespaceUri = CfdiNamespaces.CFDI_40.cfdiUri();
        private String tfdNamespaceUri = CfdiNamespaces.CFDI_40.tfdUri();
        private String requiredVersionPrefix = CfdiNamespaces.CFDI_40.requiredVersionPrefix();

        public String getNamespaceUri() {
            return namespaceUri;
        }

        public void setNamespaceUri(String namespaceUri) {
            this.namespaceUri = namespaceUri;
        }

        public String getTfdNamespaceUri() {
            return tfdNamespaceUri;
        }

        public void setTfdNamespaceUri(String tfdNamespaceUri) {
            this.tfdNamespaceUri = tfdNamespaceUri;
        }

        public String getRequiredVersionPrefix() {
            return requiredVersionPrefix;
        }

        public void setRequiredVersionPrefix(String requiredVersionPrefix) {
            this.requiredVersionPrefix = requiredVersionPrefix;
        }
    }

    public static class Cache {
        private int schemaMaxSize = DEFAULT_SCHEMA_CACHE_MAX_SIZE;
        private int schemaTtlHours = DEFAULT_SCHEMA_CACHE_TTL_HOURS;

        public int getSchemaMaxSize() {
            return schemaMaxSize;
        }

        public void setSchemaMaxSize(int schemaMaxSize) {
            this.schemaMaxSize = schemaMaxSize;
        }

        public int getSchemaTtlHours() {
            return schemaTtlHours;
        }

        public void setSchemaTtlHours(int schemaTtlHours) {
            this.schemaTtlHours = schemaTtlHours;
        }
    }

    public static class SystemVariables {
        private String zoneId = DEFAULT_ZONE_ID;

        public String getZoneId() {
            return zoneId;
        }

        public void setZoneId(String zoneId) {
            this.zoneId = zoneId;
        }
    }
}

package io.mersel.services.addenda.infrastructure.generation;

import io.mersel.services.addenda.application.interfaces.ICfdiDocument;
import io.mersel.services.addenda.application.models.CfdiLineItem;
import io.mersel.services.addenda.application.models.VariableContext;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Construye el {@link VariableContext} de una renderización.
 * <p>
 * La única dependencia del tiempo es el {@link Clock} inyectado: las variables
 * {@code current_*} se calculan con él y nada más consulta la hora.
 */
@Component
public class VariableContextFactory {

    static final String LINE_ITEMS_KEY = "conceptos";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final Clock clock;

    public VariableContextFactory(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param fieldValues valores de campos ya resueltos
     * @param cfdi        comprobante del que se extraen datos; {@code null} si no hay
     */
    public VariableContext create(Map<String, String> fieldValues, ICfdiDocument cfdi) {
        return VariableContext.builder()
                .systemVariables(systemVariables())
                .fieldValues(fieldValues)
                .cfdiData(cfdi != null ? cfdiLayer(cfdi) : Map.of())
                .build();
    }

    /**
     * {@code current_date}, {@code current_datetime}, {@code current_time},
     * {@code current_year}, {@code current_month} y {@code current_day}.
     */
    public Map<String, Object> systemVariables() {
        LocalDateTime now = LocalDateTime.now(clock);
        var vars = new LinkedHashMap<String, Object>();
        vars.put("current_date", DATE.format(now));
        vars.put("current_datetime", DATE_TIME.format(now));
        vars.put("current_time", TIME.format(now));
        vars.put("current_year", String.valueOf(now.getYear()));
        vars.put("current_month", String.format("%02d", now.getMonthValue()));
        vars.put("current_day", String.format("%02d", now.getDayOfMonth()));
        return vars;
    }

    /**
     * Datos planos del comprobante más la lista {@code conceptos}, para expresiones como
     * {@code sum(conceptos.importe)} o {@code conceptos.0.descripcion}.
     */
    Map<String, Object> cfdiLayer(ICfdiDocument cfdi) {
        var layer = new LinkedHashMap<String, Object>(cfdi.extractData());
        layer.put(LINE_ITEMS_KEY, cfdi.extractLineItems().stream().map(CfdiLineItem::toVariableMap).toList());
        return layer;
    }
}

package com.asiainfo.kpietl.infrastructure.catalog;

import com.asiainfo.kpietl.config.PipelineConfig;
import com.asiainfo.kpietl.domain.model.CategoryDefinition;
import com.asiainfo.kpietl.domain.model.FormulaType;
import com.asiainfo.kpietl.domain.model.KpiCatalog;
import com.asiainfo.kpietl.domain.model.KpiDefinition;
import com.asiainfo.kpietl.domain.model.KpiTableGroup;
import com.asiainfo.kpietl.shared.PipelineConstants;
import com.asiainfo.kpietl.shared.PipelineException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * KPI 目录加载
 * 启动时从 classpath 读取 JSON（分类、后缀映射、KPI 公式表），校验后只读共享
 */
@ApplicationScoped
public class KpiCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(KpiCatalogLoader.class);

    @Inject
    PipelineConfig config;

    @Inject
    ObjectMapper objectMapper;

    private KpiCatalog catalog;

    @PostConstruct
    void init() {
        String resource = config.getCatalogResource();
        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new PipelineException("KPI catalog not found on classpath: " + resource);
            }
            catalog = read(in, objectMapper);
        } catch (IOException e) {
            throw new PipelineException("Failed to read KPI catalog " + resource, e);
        }
        log.info("[Catalog] Loaded {} categories from {}", catalog.categories().size(), resource);
    }

    public KpiCatalog getCatalog() {
        return catalog;
    }

    public CategoryDefinition category(String name) {
        return catalog.category(name)
                .orElseThrow(() -> new PipelineException("Unknown category: " + name));
    }

    public static KpiCatalog read(InputStream in, ObjectMapper objectMapper) throws IOException {
        KpiCatalog catalog = objectMapper.readValue(in, KpiCatalog.class);
        validate(catalog);
        return catalog;
    }

    static void validate(KpiCatalog catalog) {
        Set<String> names = new HashSet<>();
        for (CategoryDefinition category : catalog.categories()) {
            if (category.name() == null || !names.add(category.name())) {
                throw new PipelineException("Missing or duplicate category name: " + category.name());
            }
            requirePattern(category.name(), "tablePattern", category.tablePattern());
            requirePattern(category.name(), "nodePattern", category.nodePattern());

            Set<String> groups = new HashSet<>();
            for (KpiTableGroup group : category.tableGroups()) {
                requireIdentifier(group.name());
                if (!groups.add(group.name())) {
                    throw new PipelineException("Duplicate table group " + group.name() + " in " + category.name());
                }
                if (category.sourceDb() == null || category.destinationDb() == null) {
                    throw new PipelineException("Category " + category.name() + " declares table groups without databases");
                }
                for (KpiDefinition kpi : group.kpis()) {
                    validateKpi(group.name(), kpi);
                }
            }
        }
    }

    private static void validateKpi(String group, KpiDefinition kpi) {
        requireIdentifier(kpi.name());
        FormulaType formula = kpi.formula();
        if (formula == null) {
            throw new PipelineException("KPI " + group + "." + kpi.name() + " has no formula");
        }
        switch (formula) {
            case RATIO, RATIO_PERCENT, COMPLEMENT_RATIO_PERCENT -> {
                if (!kpi.hasDenominator() || kpi.denominator().isEmpty()) {
                    throw new PipelineException("KPI " + group + "." + kpi.name() + " requires a denominator");
                }
            }
            case DIFFERENCE, HI_LO -> {
                if (kpi.numerator().size() < 2) {
                    throw new PipelineException("KPI " + group + "." + kpi.name() + " requires two numerator counters");
                }
            }
            case HI_LO_LOSS_PERCENT -> {
                if (!kpi.hasDenominator() || kpi.denominator().size() < 3) {
                    throw new PipelineException("KPI " + group + "." + kpi.name() + " requires hi, lo and lost denominator counters");
                }
            }
            case SCALED_SUM -> {
                if (kpi.factor() == null) {
                    throw new PipelineException("KPI " + group + "." + kpi.name() + " requires a factor");
                }
            }
            default -> {
            }
        }
    }

    private static void requirePattern(String category, String field, String regex) {
        if (regex == null) {
            throw new PipelineException("Category " + category + " has no " + field);
        }
        try {
            Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new PipelineException("Invalid " + field + " for category " + category + ": " + regex, e);
        }
    }

    private static void requireIdentifier(String name) {
        if (name == null || !PipelineConstants.SAFE_IDENTIFIER.matcher(name).matches()) {
            throw new PipelineException("Unsafe identifier in KPI catalog: " + name);
        }
    }
}

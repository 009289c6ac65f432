package com.asiainfo.kpietl.application.extract;

import com.asiainfo.kpietl.domain.model.CategoryDefinition;
import com.asiainfo.kpietl.shared.PipelineConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 选表
 * 1. 按分类命名规则过滤（一个表只归入第一个匹配的分类）
 * 2. 解析表名末尾的 _S{week}_A{year}，换算为该周周一，早于截止日期的表丢弃
 * 3. 每个分类内按 (year, week) 升序
 *
 * 周的换算：第 1 周从当年第一个周一开始，之前的日子属于第 0 周
 */
public class TableSelector {

    private static final Logger log = LoggerFactory.getLogger(TableSelector.class);

    static final int MAX_WEEK = 53;

    private final List<CategoryDefinition> categories;
    private final Map<String, Pattern> patterns = new LinkedHashMap<>();
    private final LocalDate cutoff;

    public TableSelector(List<CategoryDefinition> categories, LocalDate cutoff) {
        this.categories = categories;
        this.cutoff = cutoff;
        for (CategoryDefinition category : categories) {
            patterns.put(category.name(), category.compiledTablePattern());
        }
    }

    /**
     * 表名中的周/年
     */
    public record WeekYear(int year, int week) {

        static final Comparator<WeekYear> ORDER = Comparator.comparingInt(WeekYear::year)
                .thenComparingInt(WeekYear::week);
    }

    /**
     * 选表结果
     *
     * @param byCategory 每个分类的有序表清单（所有分类都有条目，可能为空）
     * @param workingSet 需要抽取的表，按 (year, week) 排序
     */
    public record Selection(Map<String, List<String>> byCategory, List<String> workingSet) {

        public int total() {
            return byCategory.values().stream().mapToInt(List::size).sum();
        }
    }

    public Selection select(List<String> tables, Collection<String> workingCategories) {
        Map<String, List<String>> matched = new LinkedHashMap<>();
        categories.forEach(c -> matched.put(c.name(), new ArrayList<>()));

        for (String table : tables) {
            String owner = null;
            for (Map.Entry<String, Pattern> entry : patterns.entrySet()) {
                if (!entry.getValue().matcher(table).matches()) {
                    continue;
                }
                if (owner == null) {
                    owner = entry.getKey();
                    matched.get(owner).add(table);
                } else {
                    log.warn("[Selector] Table '{}' also matches category {}, kept in {}", table, entry.getKey(), owner);
                }
            }
        }

        Map<String, List<String>> byCategory = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : matched.entrySet()) {
            List<String> selected = sortByWeekYear(filterByCutoff(entry.getValue()));
            log.info("[Selector] Category {}: {} matched, {} on/after {}",
                    entry.getKey(), entry.getValue().size(), selected.size(), cutoff);
            byCategory.put(entry.getKey(), List.copyOf(selected));
        }

        List<String> workingSet = new ArrayList<>();
        for (String category : workingCategories) {
            List<String> selected = byCategory.get(category);
            if (selected == null) {
                log.warn("[Selector] Unknown working category: {}", category);
                continue;
            }
            workingSet.addAll(selected);
        }
        return new Selection(byCategory, List.copyOf(sortByWeekYear(workingSet)));
    }

    List<String> filterByCutoff(List<String> tables) {
        List<String> kept = new ArrayList<>();
        for (String table : tables) {
            Optional<WeekYear> weekYear = parseWeekYear(table);
            if (weekYear.isEmpty()) {
                log.warn("[Selector] Skipping table '{}' - no week/year format matched", table);
                continue;
            }
            LocalDate monday;
            try {
                monday = resolveWeekStart(weekYear.get().year(), weekYear.get().week());
            } catch (DateTimeException e) {
                log.warn("[Selector] Invalid date for table '{}': {}", table, e.getMessage());
                continue;
            }
            if (monday.isBefore(cutoff)) {
                log.debug("[Selector] Skipping table '{}' with date {} before {}", table, monday, cutoff);
            } else {
                kept.add(table);
            }
        }
        return kept;
    }

    static List<String> sortByWeekYear(List<String> tables) {
        List<String> sorted = new ArrayList<>(tables);
        sorted.sort(Comparator.comparing((String t) -> parseWeekYear(t).orElseThrow(), WeekYear.ORDER));
        return sorted;
    }

    public static Optional<WeekYear> parseWeekYear(String table) {
        Matcher m = PipelineConstants.WEEK_YEAR_SUFFIX.matcher(table);
        if (!m.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new WeekYear(Integer.parseInt(m.group(2)), Integer.parseInt(m.group(1))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * 第 week 周的周一，week 取值 0..53；第 0 周可能落在上一年
     *
     * @throws DateTimeException week 越界
     */
    public static LocalDate resolveWeekStart(int year, int week) {
        if (week < 0 || week > MAX_WEEK) {
            throw new DateTimeException("Week " + week + " out of range 0.." + MAX_WEEK);
        }
        LocalDate jan1 = LocalDate.of(year, 1, 1);
        int firstWeekday = jan1.getDayOfWeek().getValue() - 1;
        if (week == 0) {
            return jan1.minusDays(firstWeekday);
        }
        int week0Length = (7 - firstWeekday) % 7;
        return jan1.plusDays(week0Length + 7L * (week - 1));
    }
}

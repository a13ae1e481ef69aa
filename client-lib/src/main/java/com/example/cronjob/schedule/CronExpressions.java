package com.example.cronjob.schedule;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.field.CronField;
import com.cronutils.model.field.CronFieldName;
import com.cronutils.model.field.expression.Always;
import com.cronutils.model.field.expression.And;
import com.cronutils.model.field.expression.Between;
import com.cronutils.model.field.expression.Every;
import com.cronutils.model.field.expression.FieldExpression;
import com.cronutils.model.field.expression.On;
import com.cronutils.model.field.value.FieldValue;
import com.cronutils.parser.CronParser;
import com.example.cronjob.model.Schedule;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Conversion between UNIX 5-field cron expressions and {@link Schedule}.
 *
 * <p>{@code toSchedule("0 9-17 * * 1-5", "UTC")} gives minutes {@code [0]},
 * hours {@code [9..17]}, week days {@code [1..5]} and {@code [-1]} for the rest.
 */
public final class CronExpressions {

    private CronExpressions() {
    }

    /**
     * @throws IllegalArgumentException if the expression is not a valid UNIX cron expression
     */
    public static Schedule toSchedule(String expression, String timezone) {
        String expr = (expression == null ? "" : expression.trim());
        if (expr.isEmpty()) {
            throw new IllegalArgumentException("cron expression is required");
        }
        Cron cron = cronParser().parse(expr);
        cron.validate();
        List<Integer> weekDays = expandField(cron, CronFieldName.DAY_OF_WEEK, 0, 6).stream()
                .map(d -> d == 7 ? 0 : d)    // 7 is Sunday as well
                .distinct()
                .sorted()
                .collect(Collectors.toCollection(ArrayList::new));
        return Schedule.builder()
                .timezone(timezone)
                .minutes(units(cron, CronFieldName.MINUTE, 0, 59))
                .hours(units(cron, CronFieldName.HOUR, 0, 23))
                .monthDays(units(cron, CronFieldName.DAY_OF_MONTH, 1, 31))
                .months(units(cron, CronFieldName.MONTH, 1, 12))
                .weekDays(collapse(weekDays, 0, 6))
                .build();
    }

    /**
     * Renders a schedule as "minute hour day-of-month month day-of-week". The timezone is not
     * part of the expression.
     */
    public static String toCron(Schedule schedule) {
        return String.join(" ",
                field(schedule.getMinutes()),
                field(schedule.getHours()),
                field(schedule.getMonthDays()),
                field(schedule.getMonths()),
                field(schedule.getWeekDays()));
    }

    private static String field(List<Integer> units) {
        if (units == null || units.isEmpty() || units.contains(Schedule.EVERY)) {
            return "*";
        }
        return units.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    private static CronParser cronParser() {
        CronDefinition def = CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX);
        return new CronParser(def);
    }

    private static List<Integer> units(Cron cron, CronFieldName name, int min, int max) {
        return collapse(expandField(cron, name, min, max), min, max);
    }

    private static List<Integer> expandField(Cron cron, CronFieldName name, int min, int max) {
        CronField field = cron.retrieve(name);
        Set<Integer> values = new TreeSet<>();
        if (field == null) {
            addRange(min, max, 1, values);
        } else {
            expand(field.getExpression(), min, max, values);
        }
        return new ArrayList<>(values);
    }

    private static void expand(FieldExpression expr, int min, int max, Set<Integer> out) {
        if (expr instanceof Always) {
            addRange(min, max, 1, out);
        } else if (expr instanceof And) {
            for (FieldExpression e : ((And) expr).getExpressions()) {
                expand(e, min, max, out);
            }
        } else if (expr instanceof Between) {
            Between b = (Between) expr;
            addRange(intValue(b.getFrom()), intValue(b.getTo()), 1, out);
        } else if (expr instanceof Every) {
            Every every = (Every) expr;
            int period = intValue(every.getPeriod());
            if (period <= 0) {
                throw new IllegalArgumentException("cron step must be > 0, got: " + period);
            }
            FieldExpression start = every.getExpression();
            if (start == null || start instanceof Always) {
                addRange(min, max, period, out);
            } else if (start instanceof Between) {
                Between b = (Between) start;
                addRange(intValue(b.getFrom()), intValue(b.getTo()), period, out);
            } else if (start instanceof On) {
                addRange(intValue(((On) start).getTime()), max, period, out);
            } else {
                throw new IllegalArgumentException("unsupported cron step: " + expr.asString());
            }
        } else if (expr instanceof On) {
            out.add(intValue(((On) expr).getTime()));
        } else {
            throw new IllegalArgumentException("unsupported cron field: " + expr.asString());
        }
    }

    private static void addRange(int from, int to, int step, Set<Integer> out) {
        for (int i = from; i <= to; i += step) {
            out.add(i);
        }
    }

    private static int intValue(FieldValue<?> value) {
        if (value == null || !(value.getValue() instanceof Integer)) {
            throw new IllegalArgumentException("unsupported cron value: " + value);
        }
        return (Integer) value.getValue();
    }

    private static List<Integer> collapse(List<Integer> values, int min, int max) {
        if (values.size() == max - min + 1) {
            return new ArrayList<>(Schedule.EVERY_UNIT);
        }
        return values;
    }
}

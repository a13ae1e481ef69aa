package com.example.cronjob.schedule;

import com.example.cronjob.model.Schedule;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.List;

/**
 * Writes a {@link Schedule} with its defaults filled in. The caller's instance is not modified.
 */
public class ScheduleSerializer extends StdSerializer<Schedule> {

    public ScheduleSerializer() {
        super(Schedule.class);
    }

    @Override
    public void serialize(Schedule value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        Schedule s = value.withDefaults();
        gen.writeStartObject();
        gen.writeStringField("timezone", s.getTimezone());
        writeUnits(gen, "hours", s.getHours());
        writeUnits(gen, "mdays", s.getMonthDays());
        writeUnits(gen, "minutes", s.getMinutes());
        writeUnits(gen, "months", s.getMonths());
        writeUnits(gen, "wdays", s.getWeekDays());
        gen.writeEndObject();
    }

    private static void writeUnits(JsonGenerator gen, String field, List<Integer> units) throws IOException {
        gen.writeArrayFieldStart(field);
        for (Integer unit : units) {
            if (unit == null) {
                throw JsonMappingException.from(gen, "null entry in schedule field " + field);
            }
            gen.writeNumber(unit);
        }
        gen.writeEndArray();
    }
}

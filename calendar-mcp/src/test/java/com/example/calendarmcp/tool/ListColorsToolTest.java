package com.example.calendarmcp.tool;

import com.example.calendarmcp.client.CalendarApiClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static com.example.calendarmcp.tool.CreateEventToolTest.structured;
import static com.example.calendarmcp.tool.CreateEventToolTest.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ListColorsToolTest {

    @Mock
    private CalendarApiClient calendarApiClient;

    @InjectMocks
    private ListColorsTool tool;

    @Test
    void listsEventPalette() throws Exception {
        when(calendarApiClient.getColors()).thenReturn(new ObjectMapper().readTree("""
                {"kind": "calendar#colors",
                 "calendar": {"1": {"background": "#ac725e", "foreground": "#1d1d1d"}},
                 "event": {
                   "1": {"background": "#a4bdfc", "foreground": "#1d1d1d"},
                   "11": {"background": "#dc2127", "foreground": "#1d1d1d"}
                 }}"""));

        Map<String, Object> result = tool.invoke(Map.of());

        assertThat(text(result)).isEqualTo("""
                Available event colors:
                Color ID: 1 - #a4bdfc (background) / #1d1d1d (foreground)
                Color ID: 11 - #dc2127 (background) / #1d1d1d (foreground)""");
        assertThat(structured(result)).extractingByKey("event").asInstanceOf(MAP).containsOnlyKeys("1", "11");
    }
}

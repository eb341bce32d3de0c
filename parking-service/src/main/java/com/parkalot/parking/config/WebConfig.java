package com.parkalot.parking.config;

import com.parkalot.parking.domain.CodedEnum;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.core.convert.converter.ConverterFactory;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Binds request parameters such as {@code ?status=confirmed} to coded enums.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverterFactory(new CodedEnumConverterFactory());
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    static class CodedEnumConverterFactory implements ConverterFactory<String, Enum> {

        @Override
        public <T extends Enum> Converter<String, T> getConverter(Class<T> targetType) {
            if (!CodedEnum.class.isAssignableFrom(targetType)) {
                return source -> (T) Enum.valueOf(targetType, source.trim().toUpperCase());
            }
            return source -> source.isBlank() ? null : (T) CodedEnum.fromCode((Class) targetType, source);
        }
    }
}

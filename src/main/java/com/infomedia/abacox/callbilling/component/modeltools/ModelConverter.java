package com.infomedia.abacox.callbilling.component.modeltools;

import org.modelmapper.ModelMapper;
import org.modelmapper.convention.MatchingStrategies;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Entity to DTO copying by exact field name.
 */
@Component
public class ModelConverter {

    private final ModelMapper modelMapper = new ModelMapper();

    public ModelConverter() {
        modelMapper.getConfiguration()
                .setMatchingStrategy(MatchingStrategies.STRICT)
                .setAmbiguityIgnored(true)
                .setFieldMatchingEnabled(true)
                .setFieldAccessLevel(org.modelmapper.config.Configuration.AccessLevel.PRIVATE);
    }

    public <T> T map(Object source, Class<T> type) {
        return modelMapper.map(source, type);
    }

    public <T> List<T> mapList(List<?> sources, Class<T> type) {
        return sources.stream().map(source -> map(source, type)).toList();
    }
}

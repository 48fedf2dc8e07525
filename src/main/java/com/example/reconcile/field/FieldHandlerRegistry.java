package com.example.reconcile.field;

import com.example.reconcile.model.FieldType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches a {@link FieldType} to its single {@link FieldHandler}.
 */
@Component
public class FieldHandlerRegistry {

    private final Map<FieldType, FieldHandler> handlers = new EnumMap<>(FieldType.class);

    public FieldHandlerRegistry(List<FieldHandler> handlerBeans) {
        for (FieldHandler handler : handlerBeans) {
            FieldHandler previous = handlers.put(handler.type(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers for " + handler.type() + ": "
                        + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }
        for (FieldType type : FieldType.values()) {
            if (!handlers.containsKey(type)) {
                throw new IllegalStateException("No handler registered for field type " + type);
            }
        }
    }

    public FieldHandler handlerFor(FieldType type) {
        return handlers.get(type);
    }
}

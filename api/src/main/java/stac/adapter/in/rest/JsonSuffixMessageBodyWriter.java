package stac.adapter.in.rest;

import java.io.IOException;
import java.io.OutputStream;
import java.lang.annotation.Annotation;
import java.lang.reflect.Type;

import jakarta.inject.Inject;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.ext.MessageBodyWriter;
import jakarta.ws.rs.ext.Provider;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;

import stac.core.model.common.MediaTypes;

/**
 * Writes GeoJSON and JSON Schema responses with the application's ObjectMapper.
 */
@Provider
@Produces({MediaTypes.GEOJSON, MediaTypes.JSON_SCHEMA})
public class JsonSuffixMessageBodyWriter implements MessageBodyWriter<Object> {

    private final ObjectMapper objectMapper;

    @Inject
    public JsonSuffixMessageBodyWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isWriteable(Class<?> type, Type genericType, Annotation[] annotations, MediaType mediaType) {
        return mediaType.getSubtype().endsWith("+json") && !String.class.equals(type);
    }

    @Override
    public void writeTo(
            Object value,
            Class<?> type,
            Type genericType,
            Annotation[] annotations,
            MediaType mediaType,
            MultivaluedMap<String, Object> httpHeaders,
            OutputStream entityStream)
            throws IOException {
        // the container owns the entity stream
        objectMapper.writer().without(JsonGenerator.Feature.AUTO_CLOSE_TARGET).writeValue(entityStream, value);
    }
}

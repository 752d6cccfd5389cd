package org.mides.delivery.converter;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import org.mides.delivery.model.Algorithm;

import java.io.IOException;

public class AlgorithmSerializer extends JsonSerializer<Algorithm> {

    @Override
    public void serialize(Algorithm algorithm, JsonGenerator gen, SerializerProvider serializer) throws IOException {
        gen.writeString(algorithm.wireName());
    }
}

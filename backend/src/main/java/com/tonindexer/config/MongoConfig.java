package com.tonindexer.config;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.tonindexer.domain.Action;
import com.tonindexer.domain.action.ActionDetails;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoManagedTypes;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * MongoDB configuration: amounts are stored as decimal strings (TON/jetton amounts exceed Decimal128 precision),
 * and every action details type is registered up front so its type alias resolves on read.
 * Indexes are created from @CompoundIndex / @Indexed on {@link Action} at startup.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(Arrays.asList(
                new BigIntegerToStringConverter(),
                new StringToBigIntegerConverter()
        ));
    }

    @Bean
    public MongoManagedTypes mongoManagedTypes() {
        return MongoManagedTypes.fromIterable(managedTypes());
    }

    static List<Class<?>> managedTypes() {
        List<Class<?>> types = new ArrayList<>();
        types.add(Action.class);
        for (JsonSubTypes.Type subType : ActionDetails.class.getAnnotation(JsonSubTypes.class).value()) {
            types.add(subType.value());
        }
        return types;
    }
}

package ippnotify.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.jsontype.SubtypeResolver;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

import ippnotify.api.annotation.AnnotationResolver;
import ippnotify.api.annotation.IppOperation;

public class JsonUtil {

    private static final Logger LOG = LoggerFactory.getLogger(JsonUtil.class);
    private static ObjectMapper mapper = new ObjectMapper();

    static {
        mapper.registerModule(new Jdk8Module());
        mapper.configure(DeserializationFeature.ACCEPT_EMPTY_ARRAY_AS_NULL_OBJECT, true);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        // one subtype per operation name, discovered from @IppOperation
        SubtypeResolver resolver = mapper.getSubtypeResolver();
        AnnotationResolver.getOperationClasses().forEach(c -> {
            for (String name : c.getAnnotation(IppOperation.class).value()) {
                LOG.trace("Registering subtype {} with class {}", name, c.getName());
                resolver.registerSubtypes(new NamedType(c, name));
            }
        });
    }

    public static ObjectMapper getObjectMapper() {
        return mapper;
    }

}

package ippnotify.api.annotation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.classgraph.ClassGraph;
import io.github.classgraph.ScanResult;
import ippnotify.api.request.IppRequest;

public class AnnotationResolver {

    private static final Logger log = LoggerFactory.getLogger(AnnotationResolver.class);
    private static final List<Class<?>> operationClasses = new ArrayList<>();

    private AnnotationResolver() {}

    static {
        ClassGraph classGraph = new ClassGraph();
        classGraph.enableClassInfo();
        classGraph.enableAnnotationInfo();
        classGraph.acceptPackages("ippnotify.api");
        try (ScanResult result = classGraph.scan()) {
            List<String> names = result.getClassesWithAnnotation(IppOperation.class.getName()).getNames();
            log.trace("Found operation classes: {}", names);
            for (String cls : names) {
                try {
                    operationClasses.add(Class.forName(cls));
                } catch (Exception e) {
                    log.error("Error loading class: " + cls, e);
                }
            }
        }
        log.trace("Loaded operation classes: {}", operationClasses);
    }

    public static List<Class<?>> getOperationClasses() {
        return Collections.unmodifiableList(operationClasses);
    }

    /**
     * @return the request class registered for the operation name, or null if no class claims it
     */
    public static Class<? extends IppRequest> getClassForOperation(String operation) {
        for (Class<?> c : operationClasses) {
            for (String name : c.getAnnotation(IppOperation.class).value()) {
                if (name.equals(operation) && IppRequest.class.isAssignableFrom(c)) {
                    log.trace("Returning {} for operation {}", c, operation);
                    return c.asSubclass(IppRequest.class);
                }
            }
        }
        return null;
    }
}

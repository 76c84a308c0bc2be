package com.vibecoding.k8scapacity.fetcher;

import com.vibecoding.k8scapacity.model.ContainerResources;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.PodTemplateSpec;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.ResourceRequirements;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * fabric8 컨테이너 모델 -> {@link ContainerResources}
 */
public final class ContainerResourcesConverter {

    public static final String CPU = "cpu";
    public static final String MEMORY = "memory";

    private ContainerResourcesConverter() {
    }

    /**
     * spec.containers만 변환한다. initContainers는 순차 실행이라 합산하지 않는다.
     */
    public static List<ContainerResources> fromContainers(List<Container> containers) {
        if (containers == null) {
            return Collections.emptyList();
        }
        List<ContainerResources> result = new ArrayList<>();
        for (Container container : containers) {
            ResourceRequirements resources = container.getResources();
            Map<String, Quantity> requests = resources != null ? resources.getRequests() : null;
            Map<String, Quantity> limits = resources != null ? resources.getLimits() : null;
            result.add(ContainerResources.builder()
                    .name(container.getName())
                    .cpuRequest(quantity(requests, CPU))
                    .memoryRequest(quantity(requests, MEMORY))
                    .cpuLimit(quantity(limits, CPU))
                    .memoryLimit(quantity(limits, MEMORY))
                    .build());
        }
        return result;
    }

    public static List<ContainerResources> fromTemplate(PodTemplateSpec template) {
        if (template == null || template.getSpec() == null) {
            return Collections.emptyList();
        }
        return fromContainers(template.getSpec().getContainers());
    }

    /**
     * Quantity를 원래 문자열("500m", "1Gi")로 되돌린다. 키가 없으면 null.
     */
    public static String quantity(Map<String, Quantity> values, String key) {
        if (values == null) {
            return null;
        }
        return toText(values.get(key));
    }

    public static String toText(Quantity quantity) {
        if (quantity == null || quantity.getAmount() == null) {
            return null;
        }
        return quantity.getFormat() != null ? quantity.getAmount() + quantity.getFormat() : quantity.getAmount();
    }
}

package com.faultline.flink;

import com.faultline.core.config.FaultlineConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.streaming.api.graph.StreamNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FaultlineJob}.
 */
class FaultlineJobTest {

    @Test
    @DisplayName("Should run the aggregation operator as a single instance with a stable uid")
    void shouldPinAggregationToOneInstance() {
        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setParallelism(4);
        FaultlineConfig faultlineConfig = new FaultlineConfig();
        faultlineConfig.validate();

        FaultlineJob.buildPipeline(env, new JobConfig.Builder().build(), faultlineConfig);

        StreamNode aggregation = env.getStreamGraph().getStreamNodes().stream()
                .filter(node -> node.getOperatorName().equals("error-aggregation"))
                .findFirst()
                .orElseThrow();
        assertThat(aggregation.getParallelism()).isEqualTo(1);
        assertThat(aggregation.getMaxParallelism()).isEqualTo(1);
        assertThat(aggregation.getTransformationUID()).isEqualTo("error-aggregation");
    }
}

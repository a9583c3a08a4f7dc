package com.whereq.launcher.model;

import com.whereq.launcher.exception.ErrorKind;
import org.junit.jupiter.api.Test;

import static com.whereq.launcher.LaunchErrors.errorOf;
import static org.assertj.core.api.Assertions.assertThat;

class ClusterEndpointTest {

    @Test
    void parsesMasterUrl() {
        ClusterEndpoint endpoint = ClusterEndpoint.parse("spark://ec2-35-171-12-195.compute-1.amazonaws.com:7077");

        assertThat(endpoint.getHost()).isEqualTo("ec2-35-171-12-195.compute-1.amazonaws.com");
        assertThat(endpoint.getPort()).isEqualTo(7077);
    }

    @Test
    void parsesBareHostAndPort() {
        assertThat(ClusterEndpoint.parse("10.0.0.12:7077")).isEqualTo(new ClusterEndpoint("10.0.0.12", 7077));
    }

    @Test
    void bracketsIpv6HostsWhenRendering() {
        assertThat(ClusterEndpoint.parse("spark://[::1]:7077").toMasterUrl()).isEqualTo("spark://[::1]:7077");
    }

    @Test
    void rejectsMalformedAddresses() {
        assertInvalid("");
        assertInvalid("spark://spark-master");
        assertInvalid("spark://:7077");
        assertInvalid("spark-master:0");
        assertInvalid("spark-master:70770");
        assertInvalid("spark-master:port");
        assertInvalid("spark master:7077");
        assertInvalid("http://spark-master:7077");
        assertInvalid("spark://spark-master:7077/path");
    }

    private static void assertInvalid(String address) {
        assertThat(errorOf(() -> ClusterEndpoint.parse(address)).getKind())
                .as(address)
                .isEqualTo(ErrorKind.INVALID_ENDPOINT);
    }
}

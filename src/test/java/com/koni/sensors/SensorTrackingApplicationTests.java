package com.koni.sensors;

import com.koni.sensors.infrastructure.persistence.mongo.ConnectionState;
import com.koni.sensors.infrastructure.persistence.mongo.MongoConnectionManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
class SensorTrackingApplicationTests {

	@Autowired
	private MongoConnectionManager connectionManager;

	@Test
	void contextLoads() {
		// Context starts without a store: the connection is only made on first use
		assertThat(connectionManager.state()).isEqualTo(ConnectionState.DISCONNECTED);
		assertThat(connectionManager.settings().hasUrl()).isFalse();
	}

}

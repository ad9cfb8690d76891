package app.scoliofit.core;

import app.scoliofit.core.adherence.store.JpaStateStore;
import app.scoliofit.core.adherence.store.StateStore;
import app.scoliofit.core.support.PostgresIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class CoreApplicationTests extends PostgresIntegrationTest {

	@Autowired
	StateStore stateStore;

	@Test
	void contextLoads() {
		assertThat(stateStore).isInstanceOf(JpaStateStore.class);
	}

}

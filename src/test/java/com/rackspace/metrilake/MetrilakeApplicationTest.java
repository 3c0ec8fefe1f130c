package com.rackspace.metrilake;

import static org.assertj.core.api.Assertions.assertThat;

import com.rackspace.metrilake.app.clients.FileSystemObjectStore;
import com.rackspace.metrilake.app.clients.HttpMonitoringSource;
import com.rackspace.metrilake.app.clients.HttpQueryEngine;
import com.rackspace.metrilake.app.clients.MonitoringSource;
import com.rackspace.metrilake.app.clients.ObjectStore;
import com.rackspace.metrilake.app.clients.QueryEngine;
import com.rackspace.metrilake.app.config.QueryProperties;
import com.rackspace.metrilake.app.web.QueryController;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

@ActiveProfiles(profiles = {"test", "query"})
@SpringBootTest(properties = "metrilake.storage.root=${java.io.tmpdir}/metrilake-test")
class MetrilakeApplicationTest {

  @Autowired
  ApplicationContext context;

  @Autowired
  QueryProperties queryProperties;

  @Test
  void wiresQueryProfile() {
    assertThat(context.getBean(MonitoringSource.class)).isInstanceOf(HttpMonitoringSource.class);
    assertThat(context.getBean(QueryEngine.class)).isInstanceOf(HttpQueryEngine.class);
    assertThat(context.getBean(ObjectStore.class)).isInstanceOf(FileSystemObjectStore.class);
    assertThat(context.getBeansOfType(QueryController.class)).hasSize(1);
    assertThat(queryProperties.getOutputLocation())
        .isEqualTo("s3://metrics-test/athena-query-results/");
  }
}

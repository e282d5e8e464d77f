package ca.gc.cra.nmapper.api;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.nmapper.domain.error.ConflictException;
import ca.gc.cra.nmapper.domain.error.InfrastructureException;
import ca.gc.cra.nmapper.domain.error.NotFoundException;
import ca.gc.cra.nmapper.domain.error.ScanException;
import ca.gc.cra.nmapper.domain.error.ServiceUnavailableException;
import ca.gc.cra.nmapper.domain.error.ValidationException;
import org.junit.jupiter.api.Test;

class ExitCodeTest {
  @Test
  void mapsErrorCategories() {
    assertEquals(ExitCode.INVALID_ARGS, ExitCode.forError(new ValidationException("bad range")));
    assertEquals(ExitCode.NOT_FOUND, ExitCode.forError(new NotFoundException("missing")));
    assertEquals(ExitCode.SCAN_FAILED, ExitCode.forError(new ScanException("exit 1")));
    assertEquals(ExitCode.UNAVAILABLE, ExitCode.forError(new InfrastructureException("down", null)));
    assertEquals(ExitCode.UNAVAILABLE, ExitCode.forError(new ServiceUnavailableException("breaker open")));
    assertEquals(ExitCode.RUNTIME_FAILURE, ExitCode.forError(new ConflictException("duplicate")));
  }

  @Test
  void numericCodesAreStable() {
    assertEquals(0, ExitCode.SUCCESS.code());
    assertEquals(2, ExitCode.INVALID_ARGS.code());
    assertEquals(130, ExitCode.INTERRUPTED.code());
  }
}

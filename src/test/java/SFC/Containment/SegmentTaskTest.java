package SFC.Containment;

import java.util.List;
import java.util.concurrent.ForkJoinPool;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import SFC.Model.Cancellation;

public class SegmentTaskTest {

  private static SegmentOutcome diverged(int segment) {
    return new SegmentOutcome.Diverged(new Witness(segment, "S" + segment, List.of(), "test"));
  }

  @Test
  void testAllPass() {
    SegmentOutcome[] outcomes = new SegmentOutcome[7];
    boolean failed = ForkJoinPool.commonPool().invoke(new SegmentTask(0, 7,
        (segment, cancellation) -> new SegmentOutcome.Passed(segment), outcomes, new Cancellation()));

    Assertions.assertFalse(failed);
    for (int k = 0; k < outcomes.length; k++) {
      Assertions.assertEquals(new SegmentOutcome.Passed(k), outcomes[k]);
    }
  }

  @Test
  void testLowestFailureSurvives() {
    SegmentOutcome[] outcomes = new SegmentOutcome[8];
    Cancellation cancellation = new Cancellation();
    boolean failed = ForkJoinPool.commonPool().invoke(new SegmentTask(0, 8,
        (segment, c) -> segment == 2 || segment == 5 ? diverged(segment) : new SegmentOutcome.Passed(0),
        outcomes, cancellation));

    Assertions.assertTrue(failed);
    Assertions.assertEquals(diverged(2), outcomes[2]);
    Assertions.assertEquals(new SegmentOutcome.Passed(0), outcomes[0]);
    Assertions.assertEquals(new SegmentOutcome.Passed(0), outcomes[1]);
    for (int k = 3; k < outcomes.length; k++) {
      // later segments either ran or were cancelled, never reported as the verdict
      Assertions.assertNotNull(outcomes[k]);
    }
    Assertions.assertTrue(cancellation.isCancelled(3));
  }

  @Test
  void testCancelledBeforeStart() {
    SegmentOutcome[] outcomes = new SegmentOutcome[3];
    Cancellation cancellation = new Cancellation();
    cancellation.recordFailure(0);
    ForkJoinPool.commonPool().invoke(new SegmentTask(0, 3,
        (segment, c) -> new SegmentOutcome.Passed(segment), outcomes, cancellation));

    Assertions.assertEquals(new SegmentOutcome.Passed(0), outcomes[0]);
    Assertions.assertEquals(new SegmentOutcome.Cancelled(), outcomes[1]);
    Assertions.assertEquals(new SegmentOutcome.Cancelled(), outcomes[2]);
    Assertions.assertFalse(outcomes[1].isFailure());
  }
}

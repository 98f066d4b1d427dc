package de.kherud.serve.batch;

import de.kherud.serve.backend.BackendKind;
import de.kherud.serve.testing.FakePredictor;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class DynamicBatchAccumulatorTest {

	private static final BatchKey SHORT = BatchKey.of(Map.of("max_new_tokens", 16));
	private static final BatchKey LONG = BatchKey.of(Map.of("max_new_tokens", 256));

	private FakePredictor predictor;
	private ExecutorService executor;
	private DynamicBatchAccumulator accumulator;

	@Before
	public void setUp() {
		predictor = new FakePredictor(BackendKind.SINGLE_PROCESS);
		executor = Executors.newCachedThreadPool();
		accumulator = new DynamicBatchAccumulator(predictor, executor, 4, Duration.ofMillis(200));
	}

	@After
	public void tearDown() {
		accumulator.close();
		executor.shutdownNow();
	}

	@Test
	public void testResultsAreScatteredByRequestIndex() throws Exception {
		List<PendingBatchEntry> window = List.of(
			new PendingBatchEntry(0, "alpha", SHORT),
			new PendingBatchEntry(1, "beta", LONG),
			new PendingBatchEntry(2, "gamma", SHORT),
			new PendingBatchEntry(3, "delta", LONG)
		);
		List<BatchOutcome> outcomes = accumulator.flush(window).get(5, TimeUnit.SECONDS);

		assertEquals(4, outcomes.size());
		assertEquals("Echo alpha", outcomes.get(0).getResult().text());
		assertEquals("Echo beta", outcomes.get(1).getResult().text());
		assertEquals("Echo gamma", outcomes.get(2).getResult().text());
		assertEquals("Echo delta", outcomes.get(3).getResult().text());

		// one backend call per distinct config, prompts in window order
		List<FakePredictor.Call> calls = predictor.getCalls();
		assertEquals(2, calls.size());
		for (FakePredictor.Call call : calls) {
			if (call.config().equals(SHORT.config())) {
				assertEquals(List.of("alpha", "gamma"), call.prompts());
			} else {
				assertEquals(LONG.config(), call.config());
				assertEquals(List.of("beta", "delta"), call.prompts());
			}
		}
	}

	@Test
	public void testFailingGroupDoesNotAffectOthers() throws Exception {
		predictor.failOn("beta");
		List<PendingBatchEntry> window = List.of(
			new PendingBatchEntry(0, "alpha", SHORT),
			new PendingBatchEntry(1, "beta", LONG),
			new PendingBatchEntry(2, "gamma", SHORT),
			new PendingBatchEntry(3, "delta", LONG)
		);
		List<BatchOutcome> outcomes = accumulator.flush(window).get(5, TimeUnit.SECONDS);

		assertTrue(outcomes.get(0).isSuccess());
		assertTrue(outcomes.get(2).isSuccess());
		assertFalse(outcomes.get(1).isSuccess());
		assertFalse(outcomes.get(3).isSuccess());
		assertTrue(outcomes.get(1).getFailure().getMessage().contains("backend exploded"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRejectsIndexOutsideWindow() {
		accumulator.flush(List.of(new PendingBatchEntry(3, "alpha", SHORT)));
	}

	@Test
	public void testConcurrentRequestsShareOneBackendCall() throws Exception {
		CompletableFuture<BatchOutcome> first = accumulator.submit("p1", SHORT);
		CompletableFuture<BatchOutcome> second = accumulator.submit("p2", BatchKey.of(Map.of("max_new_tokens", 16L)));

		assertEquals("Echo p1", first.get(5, TimeUnit.SECONDS).getOrThrow().text());
		assertEquals("Echo p2", second.get(5, TimeUnit.SECONDS).getOrThrow().text());

		List<FakePredictor.Call> calls = predictor.getCalls();
		assertEquals(1, calls.size());
		assertEquals(List.of("p1", "p2"), calls.get(0).prompts());
	}

	@Test
	public void testDifferentConfigsInOneWindowAreSplit() throws Exception {
		CompletableFuture<BatchOutcome> first = accumulator.submit("p1", SHORT);
		CompletableFuture<BatchOutcome> second = accumulator.submit("p2", LONG);

		assertEquals("Echo p1", first.get(5, TimeUnit.SECONDS).getOrThrow().text());
		assertEquals("Echo p2", second.get(5, TimeUnit.SECONDS).getOrThrow().text());
		assertEquals(2, predictor.getCalls().size());
	}
}

package org.janelia.saalfeldlab.moco.schedule;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.janelia.saalfeldlab.moco.registration.RegistrationEngine;
import org.janelia.saalfeldlab.moco.registration.RegistrationEngineException;
import org.janelia.saalfeldlab.moco.transform.FrameTransform;
import org.janelia.saalfeldlab.moco.transform.TransformExistsException;
import org.janelia.saalfeldlab.moco.transform.TransformNotFoundException;
import org.janelia.saalfeldlab.moco.transform.TransformStore;
import org.janelia.saalfeldlab.moco.volume.VolumeSet;

/**
 * Drives the registration of all frames of a {@link VolumeSet} and records
 * every frame's outcome in a {@link RegistrationLedger}.
 *
 * <p>With {@link ReferenceStrategy#FIXED}, frames are independent and run
 * on a bounded pool, a failing frame is recorded and its siblings continue.
 * With {@link ReferenceStrategy#ROLLING}, frames run one by one by distance
 * from the reference and the first failure ends the run.</p>
 *
 * <p>Transforms already in the store with matching provenance are reused
 * unless recomputing is forced.  {@link #cancel()} interrupts running
 * jobs, whose results are then discarded.  {@link #run} returns or throws
 * only after all of its jobs have stopped.</p>
 */
public class RegistrationScheduler {

	private static final long AWAIT_SECONDS = 10;

	private final RegistrationEngine engine;
	private final TransformStore store;
	private final int numJobs;

	private final AtomicInteger engineInvocations = new AtomicInteger();

	private final List<Future<?>> futures = new ArrayList<>();
	private ExecutorService exec;
	private boolean cancelled = false;

	/**
	 * @param engine
	 * @param store
	 * @param numJobs concurrent jobs for {@link ReferenceStrategy#FIXED}
	 */
	public RegistrationScheduler(final RegistrationEngine engine, final TransformStore store, final int numJobs) {

		if (numJobs < 1)
			throw new IllegalArgumentException("Number of jobs must be at least 1: " + numJobs);

		this.engine = engine;
		this.store = store;
		this.numJobs = numJobs;
	}

	/**
	 * @return how often the engine was called, reused transforms do not count
	 */
	public int getEngineInvocations() {

		return engineInvocations.get();
	}

	/**
	 * @return the ledger, complete unless an exception is thrown
	 * @throws RegistrationChainException if a rolling registration fails
	 * @throws TransformExistsException if a stored transform was computed
	 *     differently and recomputing is not forced
	 * @throws IOException if the store fails
	 * @throws CancellationException if {@link #cancel()} was called
	 */
	public RegistrationLedger run(final VolumeSet volumes, final RegistrationPlan plan)
			throws RegistrationChainException, TransformExistsException, IOException, InterruptedException {

		if (plan.getNumFrames() != volumes.size())
			throw new IllegalArgumentException("Plan for " + plan.getNumFrames() + " frames does not match " + volumes.size() + " volumes");

		System.out.println(plan);

		final RegistrationLedger ledger = new RegistrationLedger(volumes.size());
		final int reference = plan.getReferenceIndex();
		ledger.skip(reference, "reference frame", FrameTransform.identity(reference, plan.getMode(), plan.getSchedule()));
		for (int i = 0; i < volumes.size(); ++i)
			if (plan.isPassThrough(i))
				ledger.skip(i, "before start frame " + plan.getStartIndex(), null);

		final List<Integer> order = plan.getStrategy() == ReferenceStrategy.ROLLING ?
				plan.registrationOrder() :
				sequence(plan);

		synchronized (this) {
			if (cancelled)
				throw new CancellationException("Registration was cancelled");
			exec = Executors.newFixedThreadPool(plan.getStrategy() == ReferenceStrategy.ROLLING ? 1 : numJobs);
			futures.clear();
			if (plan.getStrategy() == ReferenceStrategy.ROLLING) {
				futures.add(exec.submit(() -> {
					registerChain(volumes, plan, order, ledger);
					return null;
				}));
			} else {
				for (final int i : order)
					futures.add(exec.submit(() -> {
						registerFrame(volumes, plan, i, ledger);
						return null;
					}));
			}
		}

		try {
			for (final Future<?> future : futures) {
				try {
					future.get();
				} catch (final CancellationException e) {
					/* cancelled jobs are failed below */
				} catch (final ExecutionException e) {
					cancel();
					final Throwable cause = e.getCause();
					if (cause instanceof RegistrationChainException)
						throw (RegistrationChainException)cause;
					if (cause instanceof TransformExistsException)
						throw (TransformExistsException)cause;
					if (cause instanceof IOException)
						throw (IOException)cause;
					if (cause instanceof InterruptedException)
						continue;
					if (cause instanceof RuntimeException)
						throw (RuntimeException)cause;
					throw new IllegalStateException(cause);
				}
			}
		} catch (final InterruptedException e) {
			cancel();
			throw e;
		} finally {
			awaitWorkers(exec);
		}

		if (isCancelled()) {
			final CancellationException cancellation = new CancellationException("Registration was cancelled");
			for (int i = 0; i < ledger.size(); ++i)
				ledger.abort(i, cancellation);
			throw cancellation;
		}

		System.out.println("Registration done: " + ledger);
		return ledger;
	}

	/**
	 * Stop the pool and wait until every worker has returned.  Cancelled
	 * futures report done while their jobs may still be cleaning up.
	 */
	private static void awaitWorkers(final ExecutorService exec) throws InterruptedException {

		exec.shutdownNow();
		while (!exec.awaitTermination(AWAIT_SECONDS, TimeUnit.SECONDS))
			System.out.println("Waiting for running registration jobs to stop");
	}

	private static List<Integer> sequence(final RegistrationPlan plan) {

		final List<Integer> order = new ArrayList<>();
		for (int i = 0; i < plan.getNumFrames(); ++i)
			if (plan.isScheduled(i))
				order.add(i);
		return order;
	}

	/**
	 * Interrupt all running jobs and drop queued ones.
	 */
	public synchronized void cancel() {

		cancelled = true;
		for (final Future<?> future : futures)
			future.cancel(true);
		if (exec != null)
			exec.shutdownNow();
	}

	public synchronized boolean isCancelled() {

		return cancelled;
	}

	private void registerChain(
			final VolumeSet volumes,
			final RegistrationPlan plan,
			final List<Integer> order,
			final RegistrationLedger ledger)
			throws RegistrationChainException, TransformExistsException, IOException, InterruptedException {

		for (int k = 0; k < order.size(); ++k) {
			final int i = order.get(k);
			if (Thread.currentThread().isInterrupted())
				throw new InterruptedException();

			registerFrame(volumes, plan, i, ledger);

			if (ledger.getState(i) == RegistrationState.FAILED) {
				for (final int j : order.subList(k + 1, order.size()))
					ledger.skip(j, "rolling chain broken at frame " + i, null);
				throw new RegistrationChainException(i, ledger, ledger.getOutcome(i).getError());
			}
		}
	}

	/**
	 * Register one frame, or reuse its stored transform.  Engine errors
	 * fail the frame, store errors are thrown.
	 */
	private void registerFrame(
			final VolumeSet volumes,
			final RegistrationPlan plan,
			final int index,
			final RegistrationLedger ledger) throws TransformExistsException, IOException, InterruptedException {

		final int fixed = plan.fixedIndexOf(index);

		ledger.start(index);

		if (!plan.isForce() && store.has(index, plan.getMode())) {
			final FrameTransform stored;
			try {
				stored = store.get(index, plan.getMode());
			} catch (final TransformNotFoundException e) {
				throw new IOException("Transform of frame " + index + " disappeared from the store", e);
			}
			if (!stored.hasProvenance(fixed, plan.getMode(), plan.getSchedule()))
				throw new TransformExistsException(
						index,
						plan.getMode(),
						"stored " + stored + ", requested " + plan.getMode().getName() + " " + index + " -> " + fixed + " (" + plan.getSchedule() + ")");

			System.out.println("Reusing stored transform " + stored);
			ledger.succeed(index, stored);
			return;
		}

		final FrameTransform transform;
		try {
			engineInvocations.incrementAndGet();
			transform = engine.register(volumes.get(index), volumes.get(fixed), plan.getMode(), plan.getSchedule());
		} catch (final RegistrationEngineException e) {
			ledger.fail(index, e);
			return;
		}

		/* a cancelled job's result is never stored */
		if (Thread.currentThread().isInterrupted())
			throw new InterruptedException();

		store.put(index, plan.getMode(), transform, plan.isForce());
		ledger.succeed(index, transform);
	}
}

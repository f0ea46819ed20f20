package com.coderelay.engine.tree;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.MergeCommand.FastForwardMode;
import org.eclipse.jgit.api.ResetCommand.ResetType;
import org.eclipse.jgit.api.errors.CheckoutConflictException;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.RefNotFoundException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.lib.CommitBuilder;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectInserter;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.lib.RefUpdate;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.lib.StoredConfig;
import org.eclipse.jgit.lib.TreeFormatter;
import org.eclipse.jgit.merge.MergeStrategy;
import org.eclipse.jgit.merge.ResolveMerger;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevTree;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.revwalk.filter.RevFilter;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.transport.PushResult;
import org.eclipse.jgit.transport.RefSpec;
import org.eclipse.jgit.transport.RemoteRefUpdate;
import org.eclipse.jgit.treewalk.AbstractTreeIterator;
import org.eclipse.jgit.treewalk.CanonicalTreeParser;
import org.eclipse.jgit.treewalk.EmptyTreeIterator;
import org.eclipse.jgit.util.FileUtils;
import org.eclipse.jgit.util.io.DisabledOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * {@link VersionedTree} backed by JGit.
 *
 * Layout under {@code coderelay.tree.root}:
 * <pre>
 *   trunk.git/           bare repository, the authoritative history
 *   workspaces/&lt;id&gt;/    one non-bare clone per worker (origin = trunk.git)
 * </pre>
 *
 * Merges into trunk run in-core (no working tree needed) and move the trunk
 * ref with an expected-old-value check. If a concurrent merge of a disjoint
 * path set moved trunk first, the merge is recomputed on the new head.
 */
@Component
public class GitVersionedTree implements VersionedTree {

    private static final Logger log = LoggerFactory.getLogger(GitVersionedTree.class);

    // Bound on recomputing a merge because trunk moved underneath it.
    private static final int MAX_REF_RACES = 5;

    private static final String ENGINE_NAME  = "coderelay";
    private static final String EMAIL_DOMAIN = "@coderelay.local";

    private final Path   trunkDir;
    private final String trunkBranch;

    public GitVersionedTree(@Value("${coderelay.tree.root}") String root,
                            @Value("${coderelay.tree.trunk-branch:main}") String trunkBranch) {
        this.trunkDir    = Path.of(root).toAbsolutePath().resolve("trunk.git");
        this.trunkBranch = trunkBranch;
    }

    @Override
    public String trunkBranch() {
        return trunkBranch;
    }

    // ------------------------------------------------------------------
    // Trunk lifecycle
    // ------------------------------------------------------------------

    @Override
    public synchronized String initTrunk() {
        if (Files.exists(trunkDir.resolve("HEAD"))) {
            return trunkHead();
        }
        try {
            Files.createDirectories(trunkDir);
            try (Git git = Git.init()
                    .setBare(true)
                    .setDirectory(trunkDir.toFile())
                    .setInitialBranch(trunkBranch)
                    .call();
                 ObjectInserter ins = git.getRepository().newObjectInserter()) {

                // Root commit with an empty tree so every clone has a trunk branch.
                CommitBuilder cb = new CommitBuilder();
                cb.setTreeId(ins.insert(new TreeFormatter()));
                cb.setAuthor(engineIdent());
                cb.setCommitter(engineIdent());
                cb.setMessage("Initialize trunk\n");
                ObjectId root = ins.insert(cb);
                ins.flush();

                RefUpdate ru = git.getRepository().updateRef(Constants.R_HEADS + trunkBranch);
                ru.setExpectedOldObjectId(ObjectId.zeroId());
                ru.setNewObjectId(root);
                RefUpdate.Result result = ru.update();
                if (result != RefUpdate.Result.NEW) {
                    throw new TreeIOException("Could not create trunk branch: " + result);
                }
                log.info("Initialized trunk at {} ({}@{})", trunkDir, trunkBranch, root.name());
                return root.name();
            }
        } catch (IOException | GitAPIException e) {
            throw new TreeIOException("Trunk initialization failed at " + trunkDir, e);
        }
    }

    @Override
    public String trunkHead() {
        try (Repository repo = openTrunk()) {
            return trunkRef(repo).getObjectId().name();
        } catch (IOException e) {
            throw new TreeIOException("Cannot read trunk head", e);
        }
    }

    // ------------------------------------------------------------------
    // Workspace side
    // ------------------------------------------------------------------

    @Override
    public String cloneWorkspace(Path root, String workerId) {
        try (Git git = Git.cloneRepository()
                .setURI(trunkDir.toString())
                .setDirectory(root.toFile())
                .setBranch(trunkBranch)
                .call()) {
            StoredConfig config = git.getRepository().getConfig();
            config.setString("user", null, "name", workerId);
            config.setString("user", null, "email", workerId + EMAIL_DOMAIN);
            config.save();
            String head = git.getRepository().exactRef(Constants.R_HEADS + trunkBranch).getObjectId().name();
            log.info("Cloned trunk into workspace {} at {}", root, head);
            return head;
        } catch (IOException | GitAPIException e) {
            throw new TreeIOException("Clone into " + root + " failed", e);
        }
    }

    @Override
    public void deleteWorkspace(Path root) {
        try {
            FileUtils.delete(root.toFile(), FileUtils.RECURSIVE | FileUtils.SKIP_MISSING);
        } catch (IOException e) {
            throw new TreeIOException("Could not delete workspace " + root, e);
        }
    }

    @Override
    public String workspaceRevision(Path root) {
        try (Git git = Git.open(root.toFile())) {
            Ref ref = git.getRepository().exactRef(Constants.R_HEADS + trunkBranch);
            if (ref == null) {
                throw new TreeIOException("Workspace " + root + " has no " + trunkBranch + " branch");
            }
            return ref.getObjectId().name();
        } catch (IOException e) {
            throw new TreeIOException("Cannot read workspace " + root, e);
        }
    }

    @Override
    public String createBranch(Path root, String branch, String base) {
        try (Git git = Git.open(root.toFile())) {
            checkoutOrCreate(git, branch, base == null ? trunkBranch : base);
            return Constants.R_HEADS + branch;
        } catch (CheckoutConflictException e) {
            throw new TreeConflictException("Uncommitted changes block checkout of " + branch, e.getConflictingPaths());
        } catch (RefNotFoundException e) {
            throw new IllegalArgumentException("Unknown base revision: " + base, e);
        } catch (IOException | GitAPIException e) {
            throw new TreeIOException("createBranch " + branch + " failed in " + root, e);
        }
    }

    @Override
    public String commit(Path root, String branch, Map<String, String> changes, String message) {
        if (trunkBranch.equals(branch)) {
            throw new IllegalArgumentException("Workers commit on feature branches, never on " + trunkBranch);
        }
        try (Git git = Git.open(root.toFile())) {
            checkoutOrCreate(git, branch, trunkBranch);
            for (Map.Entry<String, String> change : changes.entrySet()) {
                String path = change.getKey();
                Path file = resolveInside(root, path);
                if (change.getValue() == null) {
                    Files.deleteIfExists(file);
                    git.rm().addFilepattern(path).call();
                } else {
                    Files.createDirectories(file.getParent());
                    Files.writeString(file, change.getValue());
                    git.add().addFilepattern(path).call();
                }
            }
            RevCommit commit = git.commit().setMessage(message).call();
            log.debug("Committed {} file(s) on {} in {}: {}", changes.size(), branch, root, commit.name());
            return commit.name();
        } catch (CheckoutConflictException e) {
            throw new TreeConflictException("Uncommitted changes block checkout of " + branch, e.getConflictingPaths());
        } catch (IOException | GitAPIException e) {
            throw new TreeIOException("commit on " + branch + " failed in " + root, e);
        }
    }

    @Override
    public String publish(Path root, String branch) {
        if (trunkBranch.equals(branch)) {
            throw new IllegalArgumentException("The trunk branch only changes through merges");
        }
        String ref = Constants.R_HEADS + branch;
        try (Git git = Git.open(root.toFile())) {
            Iterable<PushResult> results = git.push()
                    .setRemote("origin")
                    .setRefSpecs(new RefSpec("+" + ref + ":" + ref))
                    .call();
            for (PushResult result : results) {
                RemoteRefUpdate update = result.getRemoteUpdate(ref);
                if (update != null
                        && update.getStatus() != RemoteRefUpdate.Status.OK
                        && update.getStatus() != RemoteRefUpdate.Status.UP_TO_DATE) {
                    throw new TreeIOException("Push of " + branch + " rejected: " + update.getStatus());
                }
            }
            Ref local = git.getRepository().exactRef(ref);
            if (local == null) {
                throw new IllegalArgumentException("No branch " + branch + " in " + root);
            }
            return local.getObjectId().name();
        } catch (IOException | GitAPIException e) {
            throw new TreeIOException("publish " + branch + " failed from " + root, e);
        }
    }

    @Override
    public String fastForward(Path root, String targetRevision) {
        try (Git git = Git.open(root.toFile())) {
            Repository repo = git.getRepository();
            fetchTrunk(git);

            ObjectId target = repo.resolve(targetRevision);
            if (target == null) {
                throw new TreeIOException("Revision " + targetRevision + " not found after fetch into " + root);
            }
            Ref local = repo.exactRef(Constants.R_HEADS + trunkBranch);

            try (RevWalk rw = new RevWalk(repo)) {
                RevCommit targetCommit  = rw.parseCommit(target);
                RevCommit currentCommit = rw.parseCommit(local.getObjectId());

                if (rw.isMergedInto(targetCommit, currentCommit)) {
                    return currentCommit.name();   // already there
                }
                if (!rw.isMergedInto(currentCommit, targetCommit)) {
                    List<String> paths = new ArrayList<>(
                            pathsBetween(repo, mergeBase(repo, currentCommit, targetCommit), currentCommit));
                    throw new TreeConflictException(
                            "Local " + trunkBranch + " in " + root + " diverged from trunk", paths);
                }

                if (trunkBranch.equals(repo.getBranch())) {
                    // Checked out: move the working tree too, refusing to clobber local edits.
                    org.eclipse.jgit.api.MergeResult r = git.merge()
                            .include(targetCommit)
                            .setFastForward(FastForwardMode.FF_ONLY)
                            .call();
                    if (!r.getMergeStatus().isSuccessful()) {
                        List<String> paths = r.getFailingPaths() == null
                                ? List.of() : new ArrayList<>(new TreeSet<>(r.getFailingPaths().keySet()));
                        throw new TreeConflictException(
                                "Fast-forward of " + root + " blocked (" + r.getMergeStatus() + ")", paths);
                    }
                } else {
                    RefUpdate ru = repo.updateRef(Constants.R_HEADS + trunkBranch);
                    ru.setExpectedOldObjectId(currentCommit);
                    ru.setNewObjectId(targetCommit);
                    RefUpdate.Result result = ru.update(rw);
                    if (result != RefUpdate.Result.FAST_FORWARD) {
                        throw new TreeIOException("Fast-forward of " + root + " failed: " + result);
                    }
                }
                return targetCommit.name();
            }
        } catch (CheckoutConflictException e) {
            throw new TreeConflictException("Fast-forward of " + root + " blocked by local edits", e.getConflictingPaths());
        } catch (IOException | GitAPIException e) {
            throw new TreeIOException("fastForward of " + root + " failed", e);
        }
    }

    @Override
    public MergeResult integrateTrunk(Path root, String branch, Map<String, String> resolutions) {
        try (Git git = Git.open(root.toFile())) {
            Repository repo = git.getRepository();
            fetchTrunk(git);
            checkoutOrCreate(git, branch, trunkBranch);
            ObjectId before = repo.resolve(Constants.HEAD);
            ObjectId trunk  = repo.resolve(Constants.R_REMOTES + "origin/" + trunkBranch);

            org.eclipse.jgit.api.MergeResult r = git.merge()
                    .include(trunk)
                    .setCommit(true)
                    .setMessage("Merge " + trunkBranch + " into " + branch)
                    .call();

            switch (r.getMergeStatus()) {
                case FAST_FORWARD, FAST_FORWARD_SQUASHED, ALREADY_UP_TO_DATE, MERGED, MERGED_SQUASHED:
                    return MergeResult.merged(repo.resolve(Constants.HEAD).name());
                case CONFLICTING: {
                    Set<String> conflicts = new TreeSet<>(r.getConflicts().keySet());
                    if (!resolutions.keySet().containsAll(conflicts)) {
                        git.reset().setMode(ResetType.HARD).setRef(before.name()).call();
                        log.info("Integrating {} into {} left {} unresolved path(s); branch restored",
                                trunkBranch, branch, conflicts.size());
                        return MergeResult.conflicted(new ArrayList<>(conflicts));
                    }
                    for (Map.Entry<String, String> resolution : resolutions.entrySet()) {
                        Path file = resolveInside(root, resolution.getKey());
                        Files.createDirectories(file.getParent());
                        Files.writeString(file, resolution.getValue());
                        git.add().addFilepattern(resolution.getKey()).call();
                    }
                    RevCommit merge = git.commit()
                            .setMessage("Merge " + trunkBranch + " into " + branch + " (resolved)")
                            .call();
                    return MergeResult.merged(merge.name());
                }
                case FAILED: {
                    List<String> paths = r.getFailingPaths() == null
                            ? List.of() : new ArrayList<>(new TreeSet<>(r.getFailingPaths().keySet()));
                    throw new TreeConflictException("Local edits block integrating " + trunkBranch, paths);
                }
                default:
                    throw new TreeIOException("Integrating " + trunkBranch + " into " + branch
                            + " ended with " + r.getMergeStatus());
            }
        } catch (CheckoutConflictException e) {
            throw new TreeConflictException("Uncommitted changes block checkout of " + branch, e.getConflictingPaths());
        } catch (IOException | GitAPIException e) {
            throw new TreeIOException("integrateTrunk on " + branch + " failed in " + root, e);
        }
    }

    // ------------------------------------------------------------------
    // Trunk side
    // ------------------------------------------------------------------

    @Override
    public PatchSet diff(String baseRevision, String headRevision) {
        try (Repository repo = openTrunk(); RevWalk rw = new RevWalk(repo)) {
            RevCommit base = rw.parseCommit(resolve(repo, baseRevision));
            RevCommit head = rw.parseCommit(resolve(repo, headRevision));
            return new PatchSet(base.name(), head.name(), scan(repo, base.getTree(), head.getTree()));
        } catch (IOException e) {
            throw new TreeIOException("diff " + baseRevision + ".." + headRevision + " failed", e);
        }
    }

    @Override
    public PatchSet touchedPaths(String sourceRef) {
        try (Repository repo = openTrunk(); RevWalk rw = new RevWalk(repo)) {
            RevCommit source = rw.parseCommit(resolve(repo, sourceRef));
            RevCommit trunk  = rw.parseCommit(trunkRef(repo).getObjectId());
            RevCommit base   = mergeBase(repo, source, trunk);
            RevTree baseTree = base == null ? null : rw.parseCommit(base).getTree();
            return new PatchSet(base == null ? null : base.name(), source.name(),
                    scan(repo, baseTree, source.getTree()));
        } catch (IOException e) {
            throw new TreeIOException("touchedPaths for " + sourceRef + " failed", e);
        }
    }

    @Override
    public MergeResult merge(String sourceRef, String message) {
        for (int race = 1; race <= MAX_REF_RACES; race++) {
            try (Repository repo = openTrunk();
                 RevWalk rw = new RevWalk(repo);
                 ObjectInserter ins = repo.newObjectInserter()) {

                RevCommit ours   = rw.parseCommit(trunkRef(repo).getObjectId());
                RevCommit theirs = rw.parseCommit(resolve(repo, sourceRef));

                if (rw.isMergedInto(theirs, ours)) {
                    log.info("{} is already contained in {}@{}", sourceRef, trunkBranch, ours.name());
                    return MergeResult.upToDate(ours.name());
                }

                ResolveMerger merger = (ResolveMerger) MergeStrategy.RECURSIVE.newMerger(repo, true);
                if (!merger.merge(ours, theirs)) {
                    Set<String> paths = new TreeSet<>(merger.getUnmergedPaths());
                    if (merger.getFailingPaths() != null) {
                        paths.addAll(merger.getFailingPaths().keySet());
                    }
                    return MergeResult.conflicted(new ArrayList<>(paths));
                }

                // Always record a merge commit so trunk history shows each proposal.
                CommitBuilder cb = new CommitBuilder();
                cb.setTreeId(merger.getResultTreeId());
                cb.setParentIds(ours, theirs);
                cb.setAuthor(engineIdent());
                cb.setCommitter(engineIdent());
                cb.setMessage(message);
                ObjectId mergeCommit = ins.insert(cb);
                ins.flush();

                RefUpdate ru = repo.updateRef(Constants.R_HEADS + trunkBranch);
                ru.setExpectedOldObjectId(ours);
                ru.setNewObjectId(mergeCommit);
                ru.setRefLogMessage("merge " + sourceRef, false);
                RefUpdate.Result result = ru.update(rw);
                switch (result) {
                    case FAST_FORWARD:
                    case FORCED:
                        return MergeResult.merged(mergeCommit.name());
                    case LOCK_FAILURE:
                        log.debug("Trunk moved while merging {} (race {}/{}), recomputing",
                                sourceRef, race, MAX_REF_RACES);
                        break;
                    default:
                        throw new TreeIOException("Updating " + trunkBranch + " failed: " + result);
                }
            } catch (IOException e) {
                throw new TreeIOException("merge of " + sourceRef + " failed", e);
            }
        }
        throw new TreeIOException("Trunk kept moving while merging " + sourceRef
                + " (" + MAX_REF_RACES + " attempts)");
    }

    @Override
    public void deleteBranch(String branch) {
        if (trunkBranch.equals(branch)) {
            throw new IllegalArgumentException("Refusing to delete the trunk branch");
        }
        try (Repository repo = openTrunk(); Git git = Git.wrap(repo)) {
            git.branchDelete().setBranchNames(Constants.R_HEADS + branch).setForce(true).call();
        } catch (IOException | GitAPIException e) {
            throw new TreeIOException("deleteBranch " + branch + " failed", e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Repository openTrunk() throws IOException {
        return new FileRepositoryBuilder()
                .setGitDir(trunkDir.toFile())
                .setMustExist(true)
                .build();
    }

    private Ref trunkRef(Repository repo) throws IOException {
        Ref ref = repo.exactRef(Constants.R_HEADS + trunkBranch);
        if (ref == null) {
            throw new TreeIOException("Trunk branch " + trunkBranch + " missing in " + trunkDir);
        }
        return ref;
    }

    private static ObjectId resolve(Repository repo, String revision) throws IOException {
        ObjectId id = repo.resolve(revision);
        if (id == null) {
            throw new IllegalArgumentException("Unknown revision: " + revision);
        }
        return id;
    }

    private void fetchTrunk(Git git) throws GitAPIException {
        git.fetch()
                .setRemote("origin")
                .setRefSpecs(new RefSpec("+" + Constants.R_HEADS + trunkBranch
                        + ":" + Constants.R_REMOTES + "origin/" + trunkBranch))
                .call();
    }

    private void checkoutOrCreate(Git git, String branch, String startPoint) throws IOException, GitAPIException {
        Repository repo = git.getRepository();
        if (branch.equals(repo.getBranch())) {
            return;
        }
        boolean exists = repo.exactRef(Constants.R_HEADS + branch) != null;
        git.checkout()
                .setName(branch)
                .setCreateBranch(!exists)
                .setStartPoint(exists ? null : startPoint)
                .call();
    }

    private static RevCommit mergeBase(Repository repo, RevCommit a, RevCommit b) throws IOException {
        try (RevWalk walk = new RevWalk(repo)) {
            walk.setRevFilter(RevFilter.MERGE_BASE);
            walk.markStart(walk.parseCommit(a));
            walk.markStart(walk.parseCommit(b));
            return walk.next();
        }
    }

    private static Set<String> pathsBetween(Repository repo, RevCommit base, RevCommit head) throws IOException {
        try (RevWalk rw = new RevWalk(repo)) {
            RevTree baseTree = base == null ? null : rw.parseCommit(base).getTree();
            RevTree headTree = rw.parseCommit(head).getTree();
            return new PatchSet(null, head.name(), scan(repo, baseTree, headTree)).paths();
        }
    }

    private static List<PatchSet.FileChange> scan(Repository repo, RevTree oldTree, RevTree newTree)
            throws IOException {
        try (ObjectReader reader = repo.newObjectReader();
             DiffFormatter df = new DiffFormatter(DisabledOutputStream.INSTANCE)) {
            df.setRepository(repo);
            df.setDetectRenames(true);
            AbstractTreeIterator oldIter = oldTree == null
                    ? new EmptyTreeIterator() : new CanonicalTreeParser(null, reader, oldTree);
            AbstractTreeIterator newIter = new CanonicalTreeParser(null, reader, newTree);

            List<PatchSet.FileChange> changes = new ArrayList<>();
            for (DiffEntry e : df.scan(oldIter, newIter)) {
                changes.add(new PatchSet.FileChange(
                        PatchSet.ChangeType.valueOf(e.getChangeType().name()),
                        e.getChangeType() == DiffEntry.ChangeType.ADD    ? null : e.getOldPath(),
                        e.getChangeType() == DiffEntry.ChangeType.DELETE ? null : e.getNewPath()));
            }
            return changes;
        }
    }

    private static Path resolveInside(Path root, String relativePath) {
        Path file = root.resolve(relativePath).normalize();
        if (!file.startsWith(root.normalize()) || file.startsWith(root.resolve(".git"))) {
            throw new IllegalArgumentException("Path escapes the workspace: " + relativePath);
        }
        return file;
    }

    private static PersonIdent engineIdent() {
        return new PersonIdent(ENGINE_NAME, ENGINE_NAME + EMAIL_DOMAIN);
    }
}

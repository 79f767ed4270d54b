package com.sitely.ledger.service;

import com.sitely.ledger.exception.LedgerConstraintException;
import com.sitely.ledger.exception.RecordNotFoundException;
import com.sitely.ledger.model.Photo;
import com.sitely.ledger.model.PhotoGroup;
import com.sitely.ledger.model.PhotoUpdate;
import com.sitely.ledger.repository.PhotoGroupRepository;
import com.sitely.ledger.repository.PhotoRepository;
import com.sitely.ledger.sync.CloudMirror;
import com.sitely.ledger.sync.MirroredEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

import static com.sitely.ledger.service.LedgerStore.newId;
import static com.sitely.ledger.service.LedgerStore.requireText;

/**
 * Site photos and the optional groups they are filed under. A photo can only
 * join a group on its own site.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PhotoService {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final StorageInitializer storageInitializer;
    private final LedgerTransactions transactions;
    private final CloudMirror cloudMirror;
    private final Clock clock;
    private final PhotoRepository photoRepository;
    private final PhotoGroupRepository photoGroupRepository;

    public Photo addPhoto(Photo photo) {
        requireText(photo.getSiteId(), "Photo site");
        requireText(photo.getUri(), "Photo uri");
        storageInitializer.awaitReady();

        Photo created = transactions.write(() -> {
            if (photo.getGroupId() != null) {
                requireGroupOnSite(photo.getGroupId(), photo.getSiteId());
            }
            Photo toInsert = photo.toBuilder()
                    .id(photo.getId() == null ? newId() : photo.getId())
                    .description(photo.getDescription() == null ? "" : photo.getDescription())
                    .date(photo.getDate() == null ? LocalDate.now(clock) : photo.getDate())
                    .time(photo.getTime() == null ? LocalTime.now(clock).format(TIME_FORMAT) : photo.getTime())
                    .build();
            photoRepository.insert(toInsert);
            return toInsert;
        });
        try {
            cloudMirror.upsert(MirroredEntity.PHOTO, created.getId(), created);
        } catch (RuntimeException e) {
            log.warn("Cloud mirror upsert of photo {} failed: {}", created.getId(), e.getMessage());
        }
        return created;
    }

    public List<Photo> listPhotos(String siteId) {
        storageInitializer.awaitReady();
        return photoRepository.findBySiteId(siteId);
    }

    public List<Photo> listPhotosInGroup(String groupId) {
        storageInitializer.awaitReady();
        return photoRepository.findByGroupId(groupId);
    }

    public void updatePhoto(String photoId, PhotoUpdate update) {
        storageInitializer.awaitReady();
        transactions.run(() -> {
            if (update.getGroupId() != null && !update.isClearGroup()) {
                String siteId = photoRepository.findSiteIdOf(photoId)
                        .orElseThrow(() -> new RecordNotFoundException(photoRepository.table(), photoId));
                requireGroupOnSite(update.getGroupId(), siteId);
            }
            if (photoRepository.update(photoId, update) == 0) {
                throw new RecordNotFoundException(photoRepository.table(), photoId);
            }
        });
    }

    public void deletePhoto(String photoId) {
        storageInitializer.awaitReady();
        transactions.run(() -> {
            if (photoRepository.deleteById(photoId) == 0) {
                throw new RecordNotFoundException(photoRepository.table(), photoId);
            }
        });
    }

    // ── Groups ───────────────────────────────────────────────────────────────

    public PhotoGroup createPhotoGroup(String siteId, String name) {
        requireText(siteId, "Photo group site");
        requireText(name, "Photo group name");
        storageInitializer.awaitReady();
        return transactions.write(() -> {
            PhotoGroup group = PhotoGroup.builder()
                    .id(newId())
                    .siteId(siteId)
                    .name(name)
                    .createdAt(clock.instant())
                    .build();
            photoGroupRepository.insert(group);
            return group;
        });
    }

    public List<PhotoGroup> listPhotoGroups(String siteId) {
        storageInitializer.awaitReady();
        return photoGroupRepository.findBySiteId(siteId);
    }

    public void renamePhotoGroup(String groupId, String name) {
        requireText(name, "Photo group name");
        storageInitializer.awaitReady();
        transactions.run(() -> {
            if (photoGroupRepository.rename(groupId, name) == 0) {
                throw new RecordNotFoundException(photoGroupRepository.table(), groupId);
            }
        });
    }

    /**
     * Deletes the group; its photos stay on the site, ungrouped.
     */
    public void deletePhotoGroup(String groupId) {
        storageInitializer.awaitReady();
        int ungrouped = transactions.write(() -> {
            int photos = photoRepository.ungroup(groupId);
            if (photoGroupRepository.deleteById(groupId) == 0) {
                throw new RecordNotFoundException(photoGroupRepository.table(), groupId);
            }
            return photos;
        });
        log.debug("Deleted photo group {}, {} photo(s) ungrouped", groupId, ungrouped);
    }

    private void requireGroupOnSite(String groupId, String siteId) {
        PhotoGroup group = photoGroupRepository.findById(groupId)
                .orElseThrow(() -> new RecordNotFoundException(photoGroupRepository.table(), groupId));
        if (!group.getSiteId().equals(siteId)) {
            throw new LedgerConstraintException("Photo group " + groupId + " belongs to another site");
        }
    }
}

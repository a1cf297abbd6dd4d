package com.example.jobsync.mapper;

import com.example.jobsync.domain.entity.Job;
import com.example.jobsync.dto.CreateJobRequest;
import com.example.jobsync.dto.JobResponse;
import com.example.jobsync.dto.UpdateJobRequest;
import org.mapstruct.BeanMapping;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.NullValuePropertyMappingStrategy;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper between job entities and API DTOs.
 * Scheduler-side fields of {@link JobResponse} are filled in by the caller.
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface JobMapper {

    JobResponse toResponse(Job job);

    List<JobResponse> toResponseList(List<Job> jobs);

    /**
     * New entity from a create request; name and schedule are expected to be normalized already
     */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "version", ignore = true)
    @Mapping(target = "lastRunDate", ignore = true)
    @Mapping(target = "lastRunSuccess", ignore = true)
    Job toEntity(CreateJobRequest request);

    /**
     * Copy the non-null fields of {@code request} onto {@code job}
     */
    @BeanMapping(nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE)
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "name", ignore = true)
    @Mapping(target = "version", ignore = true)
    @Mapping(target = "lastRunDate", ignore = true)
    @Mapping(target = "lastRunSuccess", ignore = true)
    void updateJob(UpdateJobRequest request, @MappingTarget Job job);
}
